package org.tinycompiler.compiler.frontend.parser;

import org.tinycompiler.compiler.api.CompilerErrorCode;
import org.tinycompiler.compiler.diagnostics.DiagnosticsEngine;
import org.tinycompiler.compiler.frontend.lexer.Token;
import org.tinycompiler.compiler.frontend.lexer.TokenType;
import org.tinycompiler.compiler.frontend.parser.ast.AstNode;
import org.tinycompiler.compiler.frontend.parser.ast.CallExpressionNode;
import org.tinycompiler.compiler.frontend.parser.ast.NumberLiteralNode;
import org.tinycompiler.compiler.frontend.parser.ast.ProgramNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A recursive-descent parser for the call-expression language. It consumes the list of tokens
 * produced by the {@link org.tinycompiler.compiler.frontend.lexer.Lexer} and produces the source
 * Abstract Syntax Tree (AST).
 * <p>
 * The parser looks at exactly one token, the one under its cursor, and consumes every token once.
 * There is no error recovery: the first error is reported to the diagnostics engine and ends the parse.
 * Nesting is limited to {@link #MAX_NESTING_DEPTH} so that the recursive phases after parsing
 * stay well within the thread stack.
 */
public class Parser {

    /** Deepest nesting of call expressions accepted; a top-level call is at depth 1. */
    public static final int MAX_NESTING_DEPTH = 256;

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, "<memory>");
    }

    /**
     * Constructs a new Parser with an explicit logical file name.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param logicalFileName The name of the program being parsed, for error reporting.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Parses the entire token stream into a program.
     * @return The parsed {@link ProgramNode}, or empty if an error was reported.
     */
    public Optional<ProgramNode> parse() {
        List<CallExpressionNode> body = new ArrayList<>();
        try {
            while (!isAtEnd()) {
                Token token = advance();
                if (!token.isParen('(')) {
                    throw error(CompilerErrorCode.EXPECTED_OPEN_PAREN,
                            "Expected '(' but got '" + token.text() + "'", token);
                }
                body.add(callExpression(token, 1));
            }
        } catch (ParseAbort abort) {
            return Optional.empty();
        }

        if (body.isEmpty()) {
            diagnostics.reportWarning("Program contains no expressions.", logicalFileName, 1, 1);
        }
        return Optional.of(new ProgramNode(body));
    }

    /**
     * Parses the remainder of a call expression whose '(' has already been consumed.
     * The matching ')' is the only way out of this method other than an error.
     */
    private CallExpressionNode callExpression(Token openParen, int depth) {
        if (depth > MAX_NESTING_DEPTH) {
            throw error(CompilerErrorCode.NESTING_TOO_DEEP,
                    "Call expressions are nested deeper than " + MAX_NESTING_DEPTH + " levels", openParen);
        }
        if (isAtEnd() || peek().type() != TokenType.NAME) {
            Token at = isAtEnd() ? openParen : peek();
            throw error(CompilerErrorCode.EXPECTED_FUNCTION_NAME,
                    "Expecting function name immediately after '('", at);
        }
        String name = advance().text();

        List<AstNode> params = new ArrayList<>();
        while (!isAtEnd()) {
            Token token = advance();
            switch (token.type()) {
                case PAREN -> {
                    if (token.isParen(')')) {
                        return new CallExpressionNode(name, params);
                    }
                    params.add(callExpression(token, depth + 1));
                }
                case NUMBER -> params.add(numberLiteral(token));
                case NAME -> throw error(CompilerErrorCode.UNEXPECTED_NAME_IN_ARGUMENTS,
                        "Unexpected name '" + token.text() + "' in arguments of '" + name
                                + "'; only numbers and nested calls are allowed", token);
            }
        }

        throw error(CompilerErrorCode.MISSING_CLOSING_PAREN,
                "Missing ')' to close '" + name + "'", openParen);
    }

    private NumberLiteralNode numberLiteral(Token token) {
        try {
            return new NumberLiteralNode(Integer.parseInt(token.text()));
        } catch (NumberFormatException e) {
            throw error(CompilerErrorCode.INVALID_NUMBER_LITERAL,
                    "Number literal out of range: " + token.text(), token);
        }
    }

    private ParseAbort error(CompilerErrorCode code, String message, Token at) {
        diagnostics.reportError(code, message, logicalFileName, at.line(), at.column());
        return new ParseAbort();
    }

    private Token advance() {
        return tokens.get(current++);
    }

    private Token peek() {
        return tokens.get(current);
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    /**
     * Unwinds the recursive descent after an error has been reported.
     */
    private static final class ParseAbort extends RuntimeException {
        ParseAbort() {
            super(null, null, false, false);
        }
    }
}
