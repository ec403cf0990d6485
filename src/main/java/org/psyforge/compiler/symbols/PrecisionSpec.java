package org.psyforge.compiler.symbols;

/**
 * The precision of a {@link ScalarType}: a named default, an explicit byte count,
 * or a symbol that holds the kind value at run time.
 */
public sealed interface PrecisionSpec permits ScalarType.Precision, BytePrecision, SymbolPrecision {
}
