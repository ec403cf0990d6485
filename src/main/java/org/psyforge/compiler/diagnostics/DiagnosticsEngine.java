package org.psyforge.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one reader run so that the caller can decide whether to
 * continue. The reader never throws for bad input; it reports here and recovers.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param fileName The file in which the error occurred.
     * @param line The line of the error.
     * @param column The column of the error.
     */
    public void reportError(String message, String fileName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, message, fileName, line, column));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param fileName The file in which the warning occurred.
     * @param line The line of the warning.
     * @param column The column of the warning.
     */
    public void reportWarning(String message, String fileName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, message, fileName, line, column));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    /**
     * @return the number of reported errors.
     */
    public long errorCount() {
        return diagnostics.stream().filter(d -> d.severity() == Diagnostic.Severity.ERROR).count();
    }

    /**
     * @return An unmodifiable view of all collected diagnostics, in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All diagnostics, one per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
