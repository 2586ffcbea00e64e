package org.tinycompiler.compiler.util;

import org.tinycompiler.compiler.backend.ast.CCallExpressionNode;
import org.tinycompiler.compiler.backend.ast.CExpressionStatementNode;
import org.tinycompiler.compiler.backend.ast.CIdentifierNode;
import org.tinycompiler.compiler.backend.ast.CNode;
import org.tinycompiler.compiler.backend.ast.CNumberLiteralNode;
import org.tinycompiler.compiler.backend.ast.CProgramNode;
import org.tinycompiler.compiler.frontend.parser.ast.AstNode;
import org.tinycompiler.compiler.frontend.parser.ast.CallExpressionNode;
import org.tinycompiler.compiler.frontend.parser.ast.NumberLiteralNode;
import org.tinycompiler.compiler.frontend.parser.ast.ProgramNode;
import org.tinycompiler.compiler.tree.TreeWalker;

/**
 * Utility class for rendering the intermediate trees as indented text, one node per line
 * and two spaces per level of depth.
 */
public final class AstDumper {

	private AstDumper() {}

	/**
	 * Renders a source AST.
	 * @param program The tree to render.
	 * @return The rendered tree, ending with a newline.
	 */
	public static String dump(ProgramNode program) {
		StringBuilder sb = new StringBuilder();
		new TreeWalker<AstNode>()
				.on(ProgramNode.class, (node, parent, depth) -> line(sb, depth, "Program"))
				.on(CallExpressionNode.class, (node, parent, depth) -> line(sb, depth, "CallExpression " + node.name()))
				.on(NumberLiteralNode.class, (node, parent, depth) -> line(sb, depth, "NumberLiteral " + node.value()))
				.walk(program);
		return sb.toString();
	}

	/**
	 * Renders a target tree.
	 * @param program The tree to render.
	 * @return The rendered tree, ending with a newline.
	 */
	public static String dump(CProgramNode program) {
		StringBuilder sb = new StringBuilder();
		new TreeWalker<CNode>()
				.on(CProgramNode.class, (node, parent, depth) -> line(sb, depth, "Program"))
				.on(CExpressionStatementNode.class, (node, parent, depth) -> line(sb, depth, "ExpressionStatement"))
				.on(CCallExpressionNode.class, (node, parent, depth) -> line(sb, depth, "CallExpression"))
				.on(CIdentifierNode.class, (node, parent, depth) -> line(sb, depth, "Identifier " + node.name()))
				.on(CNumberLiteralNode.class, (node, parent, depth) -> line(sb, depth, "NumberLiteral " + node.value()))
				.walk(program);
		return sb.toString();
	}

	private static void line(StringBuilder sb, int depth, String text) {
		sb.append("  ".repeat(depth)).append(text).append('\n');
	}
}
