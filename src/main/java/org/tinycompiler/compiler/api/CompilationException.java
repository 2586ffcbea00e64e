package org.tinycompiler.compiler.api;

/**
 * An exception that is thrown when an error aborts the compilation.
 * <p>
 * It is part of the public API and hides the internal error reporting of the compiler.
 * The error code and source position identify the first error that was reported.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception.
     * @param errorCode The code of the error that aborted the compilation.
     * @param message The detail message.
     * @param sourceInfo Where the error was found.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(message, null);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The code of the error that aborted the compilation.
     */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return Whether the compilation failed in the lexer or in the parser.
     */
    public ErrorKind getKind() {
        return errorCode.kind();
    }

    /**
     * @return The position of the error in the compiled program.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
