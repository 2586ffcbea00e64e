package org.tinycompiler.compiler.frontend.parser.ast;

/**
 * A visitor over the source AST with one method per node kind.
 *
 * @param <T> The result type of the visit methods.
 */
public interface AstVisitor<T> {
    T visitProgram(ProgramNode node);
    T visitCallExpression(CallExpressionNode node);
    T visitNumberLiteral(NumberLiteralNode node);
}
