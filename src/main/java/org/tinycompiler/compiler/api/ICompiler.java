package org.tinycompiler.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface of the compiler: call-expression source text in,
 * C-style source text out.
 */
public interface ICompiler {

    /**
     * Compiles the given source text.
     *
     * @param source The complete program text, e.g. {@code (add 2 (subtract 4 2))}.
     * @return The generated C-style code.
     * @throws CompilationException if a lexical or syntax error aborts the compilation.
     */
    default String compile(String source) throws CompilationException {
        return compile(source, "<memory>");
    }

    /**
     * Compiles the given source text.
     *
     * @param source The complete program text.
     * @param programName A name for the program, used in diagnostics.
     * @return The generated C-style code.
     * @throws CompilationException if a lexical or syntax error aborts the compilation.
     */
    String compile(String source, String programName) throws CompilationException;

    /**
     * Compiles the source code from a UTF-8 encoded file.
     * @param programPath The path to the source file.
     * @return The generated C-style code.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default String compileFile(Path programPath) throws CompilationException, IOException {
        return compile(Files.readString(programPath, StandardCharsets.UTF_8), programPath.toString());
    }
}
