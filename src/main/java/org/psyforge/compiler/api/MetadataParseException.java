package org.psyforge.compiler.api;

/**
 * Raised when kernel metadata text is malformed or uses a value outside the allowed vocabulary.
 */
public class MetadataParseException extends PsyirException {

    public MetadataParseException(String message) {
        super(message);
    }

    public MetadataParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
