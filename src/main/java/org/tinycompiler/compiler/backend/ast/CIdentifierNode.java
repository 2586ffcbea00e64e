package org.tinycompiler.compiler.backend.ast;

/**
 * The name of a called function.
 *
 * @param name The identifier text, copied unchanged from the source.
 */
public record CIdentifierNode(String name) implements CNode {

    @Override
    public <T> T accept(CNodeVisitor<T> visitor) {
        return visitor.visitIdentifier(this);
    }
}
