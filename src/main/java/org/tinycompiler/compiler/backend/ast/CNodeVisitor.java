package org.tinycompiler.compiler.backend.ast;

/**
 * A visitor over the target tree, with one method per node kind.
 *
 * @param <T> The result type.
 */
public interface CNodeVisitor<T> {
    T visitProgram(CProgramNode node);
    T visitExpressionStatement(CExpressionStatementNode node);
    T visitCallExpression(CCallExpressionNode node);
    T visitIdentifier(CIdentifierNode node);
    T visitNumberLiteral(CNumberLiteralNode node);
}
