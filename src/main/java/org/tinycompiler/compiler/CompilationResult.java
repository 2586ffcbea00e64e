package org.tinycompiler.compiler;

import org.tinycompiler.compiler.backend.ast.CProgramNode;
import org.tinycompiler.compiler.frontend.parser.ast.ProgramNode;

/**
 * Everything a successful compilation produced.
 *
 * @param code The generated C-style code.
 * @param sourceAst The parsed source tree.
 * @param targetAst The transformed target tree the code was generated from.
 */
public record CompilationResult(String code, ProgramNode sourceAst, CProgramNode targetAst) {
}
