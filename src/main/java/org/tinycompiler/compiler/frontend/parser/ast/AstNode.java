package org.tinycompiler.compiler.frontend.parser.ast;

import org.tinycompiler.compiler.tree.TreeNode;

/**
 * The base interface for all nodes in the source Abstract Syntax Tree (AST).
 * The set of node kinds is closed; {@link AstVisitor} has one method per kind.
 */
public sealed interface AstNode extends TreeNode<AstNode>
        permits ProgramNode, CallExpressionNode, NumberLiteralNode {

    /**
     * Accepts a visitor.
     * @param visitor The visitor to dispatch to.
     * @param <T> The result type of the visitor.
     * @return The result of the matching visit method.
     */
    <T> T accept(AstVisitor<T> visitor);
}
