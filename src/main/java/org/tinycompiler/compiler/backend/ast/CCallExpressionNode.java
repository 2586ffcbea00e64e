package org.tinycompiler.compiler.backend.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A call such as {@code add(2, 2)}: a callee identifier followed by its arguments.
 * <p>
 * The argument list is kept as given, not copied, so that the transformer can append
 * arguments while it visits the children of the corresponding source call.
 */
public final class CCallExpressionNode implements CNode {

    private final CIdentifierNode callee;
    private final List<CNode> arguments;

    /**
     * @param callee The function being called.
     * @param arguments The arguments; owned by the node from now on.
     */
    public CCallExpressionNode(CIdentifierNode callee, List<CNode> arguments) {
        this.callee = callee;
        this.arguments = arguments;
    }

    /**
     * @return The function being called.
     */
    public CIdentifierNode callee() {
        return callee;
    }

    /**
     * @return The arguments, in source order.
     */
    public List<CNode> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public List<CNode> getChildren() {
        List<CNode> children = new ArrayList<>(arguments.size() + 1);
        children.add(callee);
        children.addAll(arguments);
        return Collections.unmodifiableList(children);
    }

    @Override
    public <T> T accept(CNodeVisitor<T> visitor) {
        return visitor.visitCallExpression(this);
    }

    @Override
    public String toString() {
        return "CCallExpressionNode[" + callee.name() + arguments + "]";
    }
}
