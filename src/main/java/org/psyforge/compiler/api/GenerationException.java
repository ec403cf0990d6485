package org.psyforge.compiler.api;

/**
 * Raised when an IR node or symbol is constructed or mutated in a way that violates its shape contract.
 */
public class GenerationException extends PsyirException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
