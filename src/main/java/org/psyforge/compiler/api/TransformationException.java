package org.psyforge.compiler.api;

/**
 * Raised by the validation step of a transformation when it cannot be applied to the given target.
 */
public class TransformationException extends PsyirException {

    public TransformationException(String message) {
        super(message);
    }

    public TransformationException(String message, Throwable cause) {
        super(message, cause);
    }
}
