package org.tinycompiler.compiler.backend.ast;

import java.util.Collections;
import java.util.List;

/**
 * The root of the target tree. Its body holds one {@link CExpressionStatementNode}
 * per top-level call of the source program.
 * <p>
 * The body list is kept as given, not copied, so that the transformer can fill it while
 * building the tree. It is only ever exposed read-only.
 */
public final class CProgramNode implements CNode {

    private final List<CNode> body;

    /**
     * @param body The statements of the program; owned by the node from now on.
     */
    public CProgramNode(List<CNode> body) {
        this.body = body;
    }

    /**
     * @return The statements of the program, in source order.
     */
    public List<CNode> body() {
        return Collections.unmodifiableList(body);
    }

    @Override
    public List<CNode> getChildren() {
        return body();
    }

    @Override
    public <T> T accept(CNodeVisitor<T> visitor) {
        return visitor.visitProgram(this);
    }

    @Override
    public String toString() {
        return "CProgramNode" + body;
    }
}
