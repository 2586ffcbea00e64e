package org.tinycompiler.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param line The line number where the token begins (1-based).
 * @param column The column number where the token begins (1-based).
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column
) {

    /**
     * Checks whether this token is the given parenthesis.
     * @param paren Either '(' or ')'.
     * @return true if this is a {@link TokenType#PAREN} token with that character.
     */
    public boolean isParen(char paren) {
        return type == TokenType.PAREN && text.length() == 1 && text.charAt(0) == paren;
    }
}
