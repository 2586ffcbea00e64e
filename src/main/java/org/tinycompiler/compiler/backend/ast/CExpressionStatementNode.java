package org.tinycompiler.compiler.backend.ast;

import java.util.List;

/**
 * Wraps a top-level call so that it is emitted as a statement terminated by ';'.
 *
 * @param expression The wrapped call.
 */
public record CExpressionStatementNode(CCallExpressionNode expression) implements CNode {

    @Override
    public List<CNode> getChildren() {
        return List.of(expression);
    }

    @Override
    public <T> T accept(CNodeVisitor<T> visitor) {
        return visitor.visitExpressionStatement(this);
    }
}
