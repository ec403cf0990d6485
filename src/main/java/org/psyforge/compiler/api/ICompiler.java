package org.psyforge.compiler.api;

import java.util.List;

/**
 * The public entry point of the source-to-source compiler.
 */
public interface ICompiler {

    /**
     * Reads the given Fortran source, runs the configured transformations and renders the result.
     *
     * @param sourceLines The lines of Fortran source.
     * @param programName The logical name of the source, used in diagnostics.
     * @return The generated Fortran text.
     * @throws CompilationException if reading or transforming the source fails.
     */
    String compile(List<String> sourceLines, String programName) throws CompilationException;

    /**
     * Sets the verbosity of the compiler log.
     * @param level The new level, see {@link org.psyforge.compiler.diagnostics.CompilerLogger}.
     */
    void setVerbosity(int level);
}
