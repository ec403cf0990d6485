package org.psyforge.compiler.symbols;

/**
 * A dimension whose extent is held by an integer scalar symbol, as in {@code real :: a(n)}.
 *
 * @param symbol The symbol holding the extent.
 */
public record SymbolExtent(DataSymbol symbol) implements ArrayDimension {

    public SymbolExtent {
        if (symbol == null) {
            throw new IllegalArgumentException("An array extent symbol must not be null.");
        }
        if (!(symbol.getDatatype() instanceof ScalarType scalar) || scalar.getIntrinsic() != ScalarType.Intrinsic.INTEGER) {
            if (!(symbol.getDatatype() instanceof DeferredType)) {
                throw new IllegalArgumentException(String.format(
                        "If a DataSymbol is used as an array extent it must be a scalar integer or of "
                                + "deferred type but '%s' has type '%s'.", symbol.getName(), symbol.getDatatype()));
            }
        }
    }

    @Override
    public String toString() {
        return symbol.getName();
    }
}
