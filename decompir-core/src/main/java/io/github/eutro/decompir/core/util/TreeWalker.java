package io.github.eutro.decompir.core.util;

import io.github.eutro.decompir.core.ast.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Walks the nodes of a tree.
 */
public final class TreeWalker {
    private TreeWalker() {
    }

    /**
     * Visit every present node of a tree in pre-order. A subtree shared between several
     * parents is visited once.
     *
     * @param root    The root.
     * @param visitor The visitor.
     */
    public static void preorder(Node root, Consumer<Node> visitor) {
        Map<Node, Boolean> seen = new IdentityHashMap<>();
        List<Node> stack = new ArrayList<>();
        stack.add(root);
        while (!stack.isEmpty()) {
            Node node = stack.remove(stack.size() - 1);
            if (seen.put(node, true) != null) continue;
            if (node.isPresent()) visitor.accept(node);
            List<? extends Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.add(children.get(i));
            }
        }
    }

    /**
     * Collect the present nodes of a tree in pre-order, each once.
     *
     * @param root The root.
     * @return The nodes.
     */
    public static List<Node> nodes(Node root) {
        List<Node> nodes = new ArrayList<>();
        preorder(root, nodes::add);
        return nodes;
    }

    /**
     * Index the present nodes of a tree by id.
     *
     * @param root The root.
     * @return The nodes, by id.
     * @throws IllegalStateException If two different nodes share an id.
     */
    public static Map<Integer, Node> index(Node root) {
        Map<Integer, Node> byId = new HashMap<>();
        preorder(root, node -> {
            Node other = byId.putIfAbsent(node.id, node);
            if (other != null) {
                throw new IllegalStateException("id " + node.id + " is shared by "
                        + other.getTag() + " and " + node.getTag());
            }
        });
        return byId;
    }
}
