package org.psyforge.compiler.api;

/**
 * Signals a broken internal invariant. This indicates a bug in an earlier phase, not bad input.
 */
public class InternalCompilerException extends PsyirException {

    public InternalCompilerException(String message) {
        super(message);
    }

    public InternalCompilerException(String message, Throwable cause) {
        super(message, cause);
    }
}
