package org.psyforge.compiler.symbols;

import java.util.Arrays;
import java.util.Objects;

/**
 * A scalar type: an intrinsic kind combined with a precision.
 */
public final class ScalarType implements DataType {

    /**
     * The intrinsic kinds a scalar can have.
     */
    public enum Intrinsic {
        INTEGER("integer"),
        REAL("real"),
        BOOLEAN("logical"),
        CHARACTER("character");

        private final String fortranName;

        Intrinsic(String fortranName) {
            this.fortranName = fortranName;
        }

        /**
         * @return The Fortran keyword for this kind.
         */
        public String fortranName() {
            return fortranName;
        }
    }

    /**
     * Named precisions that leave the actual kind to the target compiler.
     */
    public enum Precision implements PrecisionSpec {
        SINGLE,
        DOUBLE,
        UNDEFINED
    }

    public static final ScalarType REAL_TYPE = new ScalarType(Intrinsic.REAL, Precision.UNDEFINED);
    public static final ScalarType REAL_SINGLE_TYPE = new ScalarType(Intrinsic.REAL, Precision.SINGLE);
    public static final ScalarType REAL_DOUBLE_TYPE = new ScalarType(Intrinsic.REAL, Precision.DOUBLE);
    public static final ScalarType REAL4_TYPE = new ScalarType(Intrinsic.REAL, 4);
    public static final ScalarType REAL8_TYPE = new ScalarType(Intrinsic.REAL, 8);
    public static final ScalarType INTEGER_TYPE = new ScalarType(Intrinsic.INTEGER, Precision.UNDEFINED);
    public static final ScalarType INTEGER_SINGLE_TYPE = new ScalarType(Intrinsic.INTEGER, Precision.SINGLE);
    public static final ScalarType INTEGER_DOUBLE_TYPE = new ScalarType(Intrinsic.INTEGER, Precision.DOUBLE);
    public static final ScalarType INTEGER4_TYPE = new ScalarType(Intrinsic.INTEGER, 4);
    public static final ScalarType INTEGER8_TYPE = new ScalarType(Intrinsic.INTEGER, 8);
    public static final ScalarType BOOLEAN_TYPE = new ScalarType(Intrinsic.BOOLEAN, Precision.UNDEFINED);
    public static final ScalarType CHARACTER_TYPE = new ScalarType(Intrinsic.CHARACTER, Precision.UNDEFINED);

    private final Intrinsic intrinsic;
    private final PrecisionSpec precision;

    /**
     * Creates a scalar type.
     *
     * @param intrinsic The intrinsic kind.
     * @param precision The precision.
     * @throws IllegalArgumentException if either argument is null.
     */
    public ScalarType(Intrinsic intrinsic, PrecisionSpec precision) {
        if (intrinsic == null) {
            throw new IllegalArgumentException(
                    "ScalarType expected 'intrinsic' argument to be one of " + Arrays.toString(Intrinsic.values())
                            + " but found 'null'.");
        }
        if (precision == null) {
            throw new IllegalArgumentException(
                    "ScalarType expected 'precision' argument to be a positive byte count, a Precision "
                            + "tag or a DataSymbol, but found 'null'.");
        }
        this.intrinsic = intrinsic;
        this.precision = precision;
    }

    /**
     * Creates a scalar type with an explicit byte precision.
     * @param intrinsic The intrinsic kind.
     * @param bytes The number of bytes, must be positive.
     */
    public ScalarType(Intrinsic intrinsic, int bytes) {
        this(intrinsic, new BytePrecision(bytes));
    }

    /**
     * Creates a scalar type whose kind is held by another symbol.
     * @param intrinsic The intrinsic kind.
     * @param kindSymbol An integer scalar or deferred-type symbol.
     */
    public ScalarType(Intrinsic intrinsic, DataSymbol kindSymbol) {
        this(intrinsic, new SymbolPrecision(kindSymbol));
    }

    public Intrinsic getIntrinsic() {
        return intrinsic;
    }

    public PrecisionSpec getPrecision() {
        return precision;
    }

    @Override
    public ScalarType copy() {
        return new ScalarType(intrinsic, precision);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarType other)) return false;
        return intrinsic == other.intrinsic && precision.equals(other.precision);
    }

    @Override
    public int hashCode() {
        return Objects.hash(intrinsic, precision);
    }

    @Override
    public String toString() {
        return "Scalar<" + intrinsic + ", " + precision + ">";
    }
}
