package org.tinycompiler.compiler.backend.ast;

/**
 * An integer literal argument.
 *
 * @param value The literal value.
 */
public record CNumberLiteralNode(int value) implements CNode {

    @Override
    public <T> T accept(CNodeVisitor<T> visitor) {
        return visitor.visitNumberLiteral(this);
    }
}
