package org.tinycompiler.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An AST node that represents one parenthesized form such as {@code (add 2 2)}.
 *
 * @param name The head symbol of the form.
 * @param params The arguments, each a {@link CallExpressionNode} or a {@link NumberLiteralNode}.
 */
public record CallExpressionNode(
        String name,
        List<AstNode> params
) implements AstNode {

    /**
     * Compact constructor making the parameter list immutable and rejecting a nested program.
     */
    public CallExpressionNode {
        params = List.copyOf(params);
        for (AstNode param : params) {
            if (param instanceof ProgramNode) {
                throw new IllegalArgumentException("A program cannot be a call parameter.");
            }
        }
    }

    @Override
    public List<AstNode> getChildren() {
        return params;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitCallExpression(this);
    }
}
