package org.psyforge.compiler.symbols;

/**
 * The symbol is declared in, and its storage belongs to, the enclosing scope.
 */
public record LocalInterface() implements SymbolInterface {
}
