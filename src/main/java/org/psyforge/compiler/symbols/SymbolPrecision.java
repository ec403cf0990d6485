package org.psyforge.compiler.symbols;

/**
 * A precision held by another symbol, for example {@code real(kind=r_def)}.
 *
 * @param symbol An integer scalar, or a symbol whose type is still deferred.
 */
public record SymbolPrecision(DataSymbol symbol) implements PrecisionSpec {

    public SymbolPrecision {
        if (symbol == null) {
            throw new IllegalArgumentException("A precision symbol must not be null.");
        }
        DataType type = symbol.getDatatype();
        boolean integerScalar = type instanceof ScalarType scalar
                && scalar.getIntrinsic() == ScalarType.Intrinsic.INTEGER;
        if (!integerScalar && !(type instanceof DeferredType)) {
            throw new IllegalArgumentException(String.format(
                    "A DataSymbol representing the precision of another DataSymbol must be of "
                            + "either 'deferred' or scalar, integer type but got: %s", symbol));
        }
    }

    @Override
    public String toString() {
        return symbol.getName();
    }
}
