package org.tinycompiler.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the wording of the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A character that is not whitespace, a parenthesis, a letter or a digit. */
    UNEXPECTED_CHARACTER(ErrorKind.LEXICAL),
    // endregion

    // region Parser Errors
    /** A top-level form does not start with '('. */
    EXPECTED_OPEN_PAREN(ErrorKind.SYNTAX),
    /** The token following '(' is not a function name. */
    EXPECTED_FUNCTION_NAME(ErrorKind.SYNTAX),
    /** A bare name was found inside a parameter list. */
    UNEXPECTED_NAME_IN_ARGUMENTS(ErrorKind.SYNTAX),
    /** The input ended before a call expression was closed. */
    MISSING_CLOSING_PAREN(ErrorKind.SYNTAX),
    /** A number literal does not fit into a 32-bit integer. */
    INVALID_NUMBER_LITERAL(ErrorKind.SYNTAX),
    /** Call expressions are nested deeper than the parser accepts. */
    NESTING_TOO_DEEP(ErrorKind.SYNTAX);
    // endregion

    private final ErrorKind kind;

    CompilerErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    /**
     * @return The category this error belongs to.
     */
    public ErrorKind kind() {
        return kind;
    }
}
