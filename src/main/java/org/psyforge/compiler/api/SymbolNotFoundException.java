package org.psyforge.compiler.api;

/**
 * Raised when a symbol lookup exhausts every enclosing scope.
 */
public class SymbolNotFoundException extends PsyirException {

    public SymbolNotFoundException(String message) {
        super(message);
    }

    public SymbolNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
