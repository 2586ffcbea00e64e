package org.tinycompiler.compiler.frontend.transform;

import org.tinycompiler.compiler.backend.ast.CCallExpressionNode;
import org.tinycompiler.compiler.backend.ast.CExpressionStatementNode;
import org.tinycompiler.compiler.backend.ast.CIdentifierNode;
import org.tinycompiler.compiler.backend.ast.CNode;
import org.tinycompiler.compiler.backend.ast.CNumberLiteralNode;
import org.tinycompiler.compiler.backend.ast.CProgramNode;
import org.tinycompiler.compiler.diagnostics.CompilerLogger;
import org.tinycompiler.compiler.frontend.parser.ast.AstNode;
import org.tinycompiler.compiler.frontend.parser.ast.AstVisitor;
import org.tinycompiler.compiler.frontend.parser.ast.CallExpressionNode;
import org.tinycompiler.compiler.frontend.parser.ast.NumberLiteralNode;
import org.tinycompiler.compiler.frontend.parser.ast.ProgramNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase: rewrites the source AST into the target tree in a single pre-order pass.
 * <p>
 * Each call or literal is built as soon as it is entered and filed into the slot that its
 * source parent registered in the {@link TransformContext}. A call whose parent is the program
 * is wrapped in a {@link CExpressionStatementNode}; a nested call is filed bare.
 * The source tree is never modified, and the slot lists of the target tree are only
 * reachable through the context, which is discarded when the pass ends.
 */
public final class AstTransformer {

    /**
     * Transforms a parsed program.
     * @param program The source AST.
     * @return The target tree.
     */
    public CProgramNode transform(ProgramNode program) {
        TransformContext context = new TransformContext();
        List<CNode> body = new ArrayList<>();
        CProgramNode target = new CProgramNode(body);
        int index = context.enter(body);
        for (AstNode child : program.getChildren()) {
            child.accept(new Enter(context, program, index));
        }
        CompilerLogger.debug("AstTransformer: transformed " + context.size() + " source nodes");
        return target;
    }

    /**
     * Handles one source node: builds its target node, registers its slot and descends.
     */
    private static final class Enter implements AstVisitor<Void> {

        private final TransformContext context;
        private final AstNode parent;
        private final int parentIndex;

        Enter(TransformContext context, AstNode parent, int parentIndex) {
            this.context = context;
            this.parent = parent;
            this.parentIndex = parentIndex;
        }

        @Override
        public Void visitProgram(ProgramNode node) {
            throw new IllegalStateException("A program cannot appear below another node");
        }

        @Override
        public Void visitCallExpression(CallExpressionNode node) {
            List<CNode> arguments = new ArrayList<>();
            CCallExpressionNode call = new CCallExpressionNode(new CIdentifierNode(node.name()), arguments);
            int index = context.enter(arguments);
            CNode filed = parent instanceof CallExpressionNode ? call : new CExpressionStatementNode(call);
            context.file(parentIndex, filed);
            if (CompilerLogger.isTraceEnabled()) {
                CompilerLogger.trace("AstTransformer: #" + index + " call '" + node.name() + "' filed under #" + parentIndex);
            }

            for (AstNode child : node.getChildren()) {
                child.accept(new Enter(context, node, index));
            }
            return null;
        }

        @Override
        public Void visitNumberLiteral(NumberLiteralNode node) {
            context.enterLeaf();
            context.file(parentIndex, new CNumberLiteralNode(node.value()));
            return null;
        }
    }
}
