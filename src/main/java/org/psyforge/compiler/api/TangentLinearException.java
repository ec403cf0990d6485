package org.psyforge.compiler.api;

/**
 * A tangent-linear assignment does not satisfy the preconditions of the adjoint rewrite.
 */
public class TangentLinearException extends TransformationException {

    public TangentLinearException(String message) {
        super(message);
    }
}
