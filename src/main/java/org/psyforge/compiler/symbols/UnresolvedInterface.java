package org.psyforge.compiler.symbols;

/**
 * The symbol is used but its declaration has not been found, typically because it may come
 * from one of several wildcard imports.
 */
public record UnresolvedInterface() implements SymbolInterface {
}
