package org.psyforge.compiler.diagnostics;

/**
 * A single message produced while reading Fortran source.
 *
 * @param severity The severity of the diagnostic.
 * @param message The diagnostic message.
 * @param fileName The logical name of the source the message refers to.
 * @param line The 1-based line number, or 0 if unknown.
 * @param column The 1-based column number, or 0 if unknown.
 */
public record Diagnostic(
        Severity severity,
        String message,
        String fileName,
        int line,
        int column
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Severity {
        /** The source cannot be turned into IR. */
        ERROR,
        /** The source was read, but part of it fell back to an unparsed code block. */
        WARNING,
        /** Informational only. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("%s:%d:%d: [%s] %s", fileName, line, column, severity, message);
    }
}
