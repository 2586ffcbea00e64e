package org.tinycompiler.compiler.frontend.parser.ast;

/**
 * An AST node that represents an integer literal.
 *
 * @param value The literal value.
 */
public record NumberLiteralNode(int value) implements AstNode {

    // This node has no children and inherits the empty list from getChildren().

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitNumberLiteral(this);
    }
}
