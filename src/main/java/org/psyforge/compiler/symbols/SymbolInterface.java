package org.psyforge.compiler.symbols;

/**
 * Describes how the storage of a symbol is provided.
 */
public sealed interface SymbolInterface
        permits LocalInterface, ImportInterface, ArgumentInterface, UnresolvedInterface {
}
