package org.tinycompiler.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A single '(' or ')' character. */
    PAREN,
    /** A run of letters, such as a function name. */
    NAME,
    /** A run of decimal digits. */
    NUMBER
}
