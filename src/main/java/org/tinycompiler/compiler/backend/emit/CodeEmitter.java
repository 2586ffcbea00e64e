package org.tinycompiler.compiler.backend.emit;

import org.tinycompiler.compiler.backend.ast.CCallExpressionNode;
import org.tinycompiler.compiler.backend.ast.CExpressionStatementNode;
import org.tinycompiler.compiler.backend.ast.CIdentifierNode;
import org.tinycompiler.compiler.backend.ast.CNode;
import org.tinycompiler.compiler.backend.ast.CNodeVisitor;
import org.tinycompiler.compiler.backend.ast.CNumberLiteralNode;
import org.tinycompiler.compiler.backend.ast.CProgramNode;

/**
 * Phase: serializes the target tree into C-style source text.
 * <p>
 * The program becomes the body of {@code int main()}; each statement is written on its own line,
 * prefixed by the configured indent. Arguments are separated by {@code ", "}.
 */
public final class CodeEmitter {

    private final String indent;

    /**
     * Creates an emitter using two spaces of indentation.
     */
    public CodeEmitter() {
        this("  ");
    }

    /**
     * @param indent The text written in front of every statement.
     */
    public CodeEmitter(String indent) {
        this.indent = indent;
    }

    /**
     * Generates the text of a whole program.
     * @param program The target tree.
     * @return The generated code, ending with a newline.
     */
    public String emit(CProgramNode program) {
        StringBuilder out = new StringBuilder();
        program.accept(new Writer(out));
        return out.toString();
    }

    private final class Writer implements CNodeVisitor<Void> {

        private final StringBuilder out;

        Writer(StringBuilder out) {
            this.out = out;
        }

        @Override
        public Void visitProgram(CProgramNode node) {
            out.append("int main()\n{\n");
            for (CNode statement : node.body()) {
                statement.accept(this);
            }
            out.append("}\n");
            return null;
        }

        @Override
        public Void visitExpressionStatement(CExpressionStatementNode node) {
            out.append(indent);
            node.expression().accept(this);
            out.append(";\n");
            return null;
        }

        @Override
        public Void visitCallExpression(CCallExpressionNode node) {
            node.callee().accept(this);
            out.append('(');
            boolean first = true;
            for (CNode argument : node.arguments()) {
                if (!first) {
                    out.append(", ");
                }
                argument.accept(this);
                first = false;
            }
            out.append(')');
            return null;
        }

        @Override
        public Void visitIdentifier(CIdentifierNode node) {
            out.append(node.name());
            return null;
        }

        @Override
        public Void visitNumberLiteral(CNumberLiteralNode node) {
            out.append(node.value());
            return null;
        }
    }
}
