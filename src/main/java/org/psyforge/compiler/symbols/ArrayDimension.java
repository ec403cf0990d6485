package org.psyforge.compiler.symbols;

/**
 * One entry of an {@link ArrayType} shape.
 */
public sealed interface ArrayDimension permits ArrayType.Extent, LiteralExtent, SymbolExtent {
}
