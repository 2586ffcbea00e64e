package org.tinycompiler.compiler.tree;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for nodes that can be traversed by a {@link TreeWalker}.
 *
 * @param <N> The node family, e.g. all source-tree nodes or all target-tree nodes.
 */
public interface TreeNode<N extends TreeNode<N>> {
    /**
     * Returns a list of the direct child nodes, in source order.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<N> getChildren() {
        return Collections.emptyList();
    }
}
