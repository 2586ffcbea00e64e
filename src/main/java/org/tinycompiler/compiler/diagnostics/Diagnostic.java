package org.tinycompiler.compiler.diagnostics;

import org.tinycompiler.compiler.api.CompilerErrorCode;
import org.tinycompiler.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error, warning)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code, or {@code null} for diagnostics that are not errors.
 * @param message The diagnostic message.
 * @param fileName The name of the program in which the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The column number of the issue.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that aborts compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING
    }

    /**
     * @return The position of this diagnostic as a public {@link SourceInfo}.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, lineNumber, columnNumber);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName, lineNumber, columnNumber, message);
    }
}
