package io.github.eutro.decompir.core.ast.display;

import io.github.eutro.decompir.core.ast.Node;

import java.util.List;

/**
 * Dumps the structure of a tree as one {@code id:tag} line per node, indented by depth.
 */
public final class StructureDisplay {
    private StructureDisplay() {
    }

    public static String show(Node root) {
        StringBuilder sb = new StringBuilder();
        show(sb, root, 0);
        return sb.toString();
    }

    private static void show(StringBuilder sb, Node node, int depth) {
        if (!node.isPresent()) return;
        for (int i = 0; i < depth; i++) sb.append("  ");
        sb.append(node.id).append(':').append(node.getTag()).append('\n');
        List<? extends Node> children = node.children();
        for (Node child : children) show(sb, child, depth + 1);
    }
}
