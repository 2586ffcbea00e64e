package org.tinycompiler.compiler;

import org.tinycompiler.compiler.api.CompilationException;
import org.tinycompiler.compiler.api.CompilerOptions;
import org.tinycompiler.compiler.api.ICompiler;
import org.tinycompiler.compiler.backend.ast.CProgramNode;
import org.tinycompiler.compiler.backend.emit.CodeEmitter;
import org.tinycompiler.compiler.diagnostics.CompilerLogger;
import org.tinycompiler.compiler.diagnostics.Diagnostic;
import org.tinycompiler.compiler.diagnostics.DiagnosticsEngine;
import org.tinycompiler.compiler.frontend.lexer.Lexer;
import org.tinycompiler.compiler.frontend.lexer.Token;
import org.tinycompiler.compiler.frontend.parser.Parser;
import org.tinycompiler.compiler.frontend.parser.ast.ProgramNode;
import org.tinycompiler.compiler.frontend.transform.AstTransformer;
import org.tinycompiler.compiler.util.AstDumper;

import java.util.List;
import java.util.Optional;

/**
 * The main compiler implementation. This class orchestrates the pipeline
 * lexer, parser, transformer and emitter. It holds no state between calls,
 * so one instance may be shared.
 * <p>
 * The verbosity in {@link CompilerOptions} is not applied here; the {@link CompilerLogger}
 * level is process-wide and is set once by the driver.
 */
public class Compiler implements ICompiler {

    private final CompilerOptions options;

    /**
     * Creates a compiler with {@link CompilerOptions#DEFAULT}.
     */
    public Compiler() {
        this(CompilerOptions.DEFAULT);
    }

    /**
     * @param options The options applied to every compilation.
     */
    public Compiler(CompilerOptions options) {
        this.options = options;
    }

    @Override
    public String compile(String source, String programName) throws CompilationException {
        return compileToResult(source, programName).code();
    }

    /**
     * Compiles the given source text and keeps the intermediate trees.
     *
     * @param source The complete program text.
     * @param programName A name for the program, used in diagnostics.
     * @return The generated code together with both trees.
     * @throws CompilationException if a lexical or syntax error aborts the compilation.
     */
    public CompilationResult compileToResult(String source, String programName) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(source, diagnostics, programName).scanTokens();
        abortOnErrors(diagnostics);
        CompilerLogger.debug("Compiler: " + programName + " scanned into " + tokens.size() + " tokens");

        // Phase 2: Parsing (builds the source AST)
        Optional<ProgramNode> parsed = new Parser(tokens, diagnostics, programName).parse();
        abortOnErrors(diagnostics);
        ProgramNode sourceAst = parsed.orElseThrow(() -> new IllegalStateException("Parser returned no program without reporting an error"));
        diagnostics.getDiagnostics().stream()
                .filter(d -> d.type() == Diagnostic.Type.WARNING)
                .forEach(d -> CompilerLogger.warn(d.toString()));

        // Phase 3: Transformation (source AST to target AST)
        CProgramNode targetAst = new AstTransformer().transform(sourceAst);
        CompilerLogger.debug("Compiler: " + programName + " has " + targetAst.body().size() + " statements");
        dumpTrees(sourceAst, targetAst);

        // Phase 4: Code Generation
        String code = new CodeEmitter(options.indent()).emit(targetAst);
        return new CompilationResult(code, sourceAst, targetAst);
    }

    private void dumpTrees(ProgramNode sourceAst, CProgramNode targetAst) {
        if (options.dumpTrees()) {
            CompilerLogger.info("Source AST:\n" + AstDumper.dump(sourceAst));
            CompilerLogger.info("Target AST:\n" + AstDumper.dump(targetAst));
        } else if (CompilerLogger.isTraceEnabled()) {
            CompilerLogger.trace("Source AST:\n" + AstDumper.dump(sourceAst));
            CompilerLogger.trace("Target AST:\n" + AstDumper.dump(targetAst));
        }
    }

    private static void abortOnErrors(DiagnosticsEngine diagnostics) throws CompilationException {
        Optional<Diagnostic> first = diagnostics.firstError();
        if (first.isPresent()) {
            Diagnostic error = first.get();
            throw new CompilationException(error.code(), diagnostics.summary(), error.sourceInfo());
        }
    }
}
