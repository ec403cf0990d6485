package org.psyforge.compiler.symbols;

/**
 * Describes the type of a {@link DataSymbol}: a scalar, an array of some element type,
 * a type that is not known yet, or a declaration the IR keeps as text only.
 */
public sealed interface DataType permits ScalarType, ArrayType, DeferredType, UnsupportedType {

    /**
     * @return A copy of this descriptor. Immutable descriptors may return themselves.
     */
    DataType copy();
}
