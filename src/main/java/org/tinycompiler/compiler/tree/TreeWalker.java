package org.tinycompiler.compiler.tree;

import java.util.HashMap;
import java.util.Map;

/**
 * A generic class for traversing a tree depth-first in pre-order.
 * Instead of a fixed visitor interface, this walker uses handlers registered per node
 * class, so a caller only deals with the node kinds it cares about. Nodes without a
 * handler are passed over silently unless a catch-all handler was registered with
 * {@link #onAny(NodeHandler)}. Their children are visited either way.
 *
 * @param <N> The node family being walked.
 */
public class TreeWalker<N extends TreeNode<N>> {

    private final Map<Class<?>, NodeHandler<N, N>> handlers = new HashMap<>();
    private NodeHandler<N, N> fallback = (node, parent, depth) -> { };

    /**
     * Registers the handler for one node class. A later registration for the same class replaces the earlier one.
     *
     * @param nodeType The concrete node class.
     * @param handler The handler receiving nodes of that class.
     * @param <T> The concrete node type.
     * @return This walker, for chaining.
     */
    public <T extends N> TreeWalker<N> on(Class<T> nodeType, NodeHandler<? super T, N> handler) {
        handlers.put(nodeType, (node, parent, depth) -> handler.handle(nodeType.cast(node), parent, depth));
        return this;
    }

    /**
     * Registers a handler for every node class that has no handler of its own.
     *
     * @param handler The catch-all handler.
     * @return This walker, for chaining.
     */
    public TreeWalker<N> onAny(NodeHandler<N, N> handler) {
        this.fallback = handler;
        return this;
    }

    /**
     * Walks a tree starting at its root, which is reported at depth 0 with no parent.
     * @param root The root node.
     */
    public void walk(N root) {
        walk(root, null, 0);
    }

    private void walk(N node, N parent, int depth) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getClass(), fallback).handle(node, parent, depth);

        for (N child : node.getChildren()) {
            walk(child, node, depth + 1);
        }
    }
}
