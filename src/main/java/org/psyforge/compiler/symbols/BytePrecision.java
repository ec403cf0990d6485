package org.psyforge.compiler.symbols;

/**
 * An explicit precision given as a number of bytes, as in {@code real*8} or {@code real(8)}.
 *
 * @param bytes The number of bytes, always positive.
 */
public record BytePrecision(int bytes) implements PrecisionSpec {

    public BytePrecision {
        if (bytes <= 0) {
            throw new IllegalArgumentException(String.format(
                    "The precision of a ScalarType when stored as an integer should be a "
                            + "positive integer but found '%d'.", bytes));
        }
    }

    @Override
    public String toString() {
        return Integer.toString(bytes);
    }
}
