package org.psyforge.compiler.api;

/**
 * Base class of all unchecked errors raised by the IR core. Subclasses distinguish
 * malformed input ({@link MetadataParseException}), shape violations while building or
 * mutating the tree ({@link GenerationException}), failed transformation preconditions
 * ({@link TransformationException}) and broken internal invariants
 * ({@link InternalCompilerException}).
 */
public class PsyirException extends RuntimeException {

    /**
     * @param message The detail message.
     */
    public PsyirException(String message) {
        super(message);
    }

    /**
     * @param message The detail message.
     * @param cause The cause.
     */
    public PsyirException(String message, Throwable cause) {
        super(message, cause);
    }
}
