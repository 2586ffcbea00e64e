package org.tinycompiler.compiler.api;

/**
 * The broad category of a compilation error.
 */
public enum ErrorKind {
    /** A character in the source matches none of the recognized character classes. */
    LEXICAL,
    /** The token stream does not form a valid program. */
    SYNTAX
}
