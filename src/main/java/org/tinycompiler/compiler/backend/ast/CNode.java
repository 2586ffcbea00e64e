package org.tinycompiler.compiler.backend.ast;

import org.tinycompiler.compiler.tree.TreeNode;

/**
 * The base interface for all nodes of the target tree, the C-like AST that the
 * code emitter turns into text.
 */
public sealed interface CNode extends TreeNode<CNode>
        permits CProgramNode, CExpressionStatementNode, CCallExpressionNode, CIdentifierNode, CNumberLiteralNode {

    /**
     * Accepts a visitor.
     * @param visitor The visitor to dispatch to.
     * @param <T> The result type of the visitor.
     * @return The result of the matching visit method.
     */
    <T> T accept(CNodeVisitor<T> visitor);
}
