package io.github.eutro.decompir.core.ast;

import java.util.List;

/**
 * A node in the abstract syntax tree of a single decompiled function.
 * <p>
 * Nodes are immutable. Every node carries an integer id which is unique among the nodes of
 * one function's tree, except for {@link #NO_ID}, which marks absent or ignored placeholders
 * and may be shared by any number of them. Analyses refer to nodes by id rather than
 * annotating them.
 */
public abstract class Node {
    /**
     * The id of placeholder nodes, such as the {@link Lval#IGNORED ignored lvalue} or {@link NoOffset#INSTANCE}.
     */
    public static final int NO_ID = -1;

    /**
     * The id of this node.
     */
    public final int id;

    Node(int id) {
        this.id = id;
    }

    /**
     * Get the tag of this node, naming its variant.
     *
     * @return The tag.
     */
    public abstract String getTag();

    /**
     * Get the direct children of this node, in the order they are serialized.
     * <p>
     * Placeholders are included; consumers skip them by checking {@link #isPresent()}.
     *
     * @return The children.
     */
    public abstract List<? extends Node> children();

    /**
     * Render this node as C-like source text.
     *
     * @param indent The number of spaces to indent statements by.
     * @return The rendering.
     */
    public abstract String toCLike(int indent);

    /**
     * Render this node as C-like source text, without indentation.
     *
     * @return The rendering.
     */
    public String toCLike() {
        return toCLike(0);
    }

    /**
     * Whether this node is a real node, rather than an absent placeholder.
     *
     * @return Whether the id of this node is not {@link #NO_ID}.
     */
    public boolean isPresent() {
        return id != NO_ID;
    }

    static String spaces(int n) {
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; i++) sb.append(' ');
        return sb.toString();
    }
}
