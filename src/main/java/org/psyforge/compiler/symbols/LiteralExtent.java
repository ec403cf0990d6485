package org.psyforge.compiler.symbols;

/**
 * A dimension with a fixed, known extent.
 *
 * @param extent The extent, always positive.
 */
public record LiteralExtent(int extent) implements ArrayDimension {

    public LiteralExtent {
        if (extent <= 0) {
            throw new IllegalArgumentException("An array extent must be positive but found '" + extent + "'.");
        }
    }

    @Override
    public String toString() {
        return Integer.toString(extent);
    }
}
