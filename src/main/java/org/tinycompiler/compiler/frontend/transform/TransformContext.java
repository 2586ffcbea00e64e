package org.tinycompiler.compiler.frontend.transform;

import org.tinycompiler.compiler.backend.ast.CNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable side table used during one transformation.
 * <p>
 * Every source node is given an index in the order it is entered (pre-order). For nodes that
 * can have children, the index maps to the list in the new target node that their children
 * must be appended to. Leaf nodes occupy an index without a slot.
 */
final class TransformContext {

    private final List<List<CNode>> slots = new ArrayList<>();

    /**
     * Enters a source node that owns a target slot.
     * @param slot The child list of the target node built for it.
     * @return The index assigned to the source node.
     */
    int enter(List<CNode> slot) {
        slots.add(slot);
        return slots.size() - 1;
    }

    /**
     * Enters a source node that never receives children.
     * @return The index assigned to the source node.
     */
    int enterLeaf() {
        slots.add(null);
        return slots.size() - 1;
    }

    /**
     * Appends a finished target node to the slot of its source parent.
     * @param parentIndex The index of the source parent.
     * @param node The target node to file.
     * @throws IllegalStateException if the parent has not been entered or has no slot.
     */
    void file(int parentIndex, CNode node) {
        if (parentIndex < 0 || parentIndex >= slots.size() || slots.get(parentIndex) == null) {
            throw new IllegalStateException("No target slot registered for source node #" + parentIndex
                    + " while filing " + node);
        }
        slots.get(parentIndex).add(node);
    }

    /**
     * @return The number of source nodes entered so far.
     */
    int size() {
        return slots.size();
    }
}
