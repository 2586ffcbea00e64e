package org.tinycompiler.compiler.frontend.lexer;

import org.tinycompiler.compiler.api.CompilerErrorCode;
import org.tinycompiler.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * It is a small state machine with at most one pending name or number. Switching
 * into a pending state does not consume the current character, and neither does
 * leaving it: the character is examined again in the new state.
 */
public class Lexer {

    private enum State {
        LOOKING,
        IN_NAME,
        IN_NUMBER
    }

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private final List<Token> tokens = new ArrayList<>();
    private final StringBuilder pending = new StringBuilder();
    private State state = State.LOOKING;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int pendingLine;
    private int pendingColumn;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the program being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * Scanning stops at the first unexpected character, which is reported to the diagnostics engine.
     * @return A list of the recognized tokens.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            char c = source.charAt(current);
            switch (state) {
                case LOOKING -> {
                    if (!looking(c)) {
                        return tokens;
                    }
                }
                case IN_NAME -> accumulate(c, isAlpha(c), TokenType.NAME);
                case IN_NUMBER -> accumulate(c, isDigit(c), TokenType.NUMBER);
            }
        }
        // A name or number running up to the end of the input is still a token.
        if (state == State.IN_NAME) {
            flush(TokenType.NAME);
        } else if (state == State.IN_NUMBER) {
            flush(TokenType.NUMBER);
        }
        return tokens;
    }

    private boolean looking(char c) {
        if (isWhitespace(c)) {
            advance();
        } else if (c == '(' || c == ')') {
            tokens.add(new Token(TokenType.PAREN, String.valueOf(c), line, column));
            advance();
        } else if (isAlpha(c)) {
            startPending(State.IN_NAME);
        } else if (isDigit(c)) {
            startPending(State.IN_NUMBER);
        } else {
            diagnostics.reportError(CompilerErrorCode.UNEXPECTED_CHARACTER,
                    "Unexpected character: '" + c + "'", logicalFileName, line, column);
            return false;
        }
        return true;
    }

    private void accumulate(char c, boolean matches, TokenType type) {
        if (matches) {
            pending.append(c);
            advance();
        } else {
            flush(type);
        }
    }

    private void startPending(State newState) {
        state = newState;
        pending.setLength(0);
        pendingLine = line;
        pendingColumn = column;
    }

    private void flush(TokenType type) {
        tokens.add(new Token(type, pending.toString(), pendingLine, pendingColumn));
        pending.setLength(0);
        state = State.LOOKING;
    }

    private void advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
