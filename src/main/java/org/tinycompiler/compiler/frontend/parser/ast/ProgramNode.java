package org.tinycompiler.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The root of the source AST: the top-level call expressions in source order.
 *
 * @param body The top-level call expressions.
 */
public record ProgramNode(List<CallExpressionNode> body) implements AstNode {

    /**
     * Compact constructor making the body immutable.
     */
    public ProgramNode {
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(body);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitProgram(this);
    }
}
