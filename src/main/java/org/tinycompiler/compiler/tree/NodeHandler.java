package org.tinycompiler.compiler.tree;

/**
 * Callback invoked by the {@link TreeWalker} when it reaches a node.
 *
 * @param <T> The type of node handled.
 * @param <P> The type of the parent node.
 */
@FunctionalInterface
public interface NodeHandler<T, P> {
    /**
     * Handles a node before any of its children are visited.
     *
     * @param node The node being visited.
     * @param parent The parent of the node, or {@code null} for the root.
     * @param depth The depth of the node; the root is at depth 0.
     */
    void handle(T node, P parent, int depth);
}
