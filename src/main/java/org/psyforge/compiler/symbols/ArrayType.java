package org.psyforge.compiler.symbols;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An array of scalar (or not yet known) elements with a fixed rank.
 */
public final class ArrayType implements DataType {

    /**
     * Placeholders for extents that are not available as a number or symbol.
     */
    public enum Extent implements ArrayDimension {
        /** Not fixed yet, e.g. an allocatable array ({@code :}). */
        DEFERRED,
        /** Fixed, but only known at run time, e.g. an assumed-shape argument ({@code :}). */
        ATTRIBUTE
    }

    private final DataType elementType;
    private final List<ArrayDimension> shape;

    /**
     * Creates an array type.
     *
     * @param elementType The element type: a scalar, deferred or unsupported type.
     * @param shape One entry per dimension; the rank is fixed from here on.
     * @throws IllegalArgumentException if the element type or shape is invalid.
     */
    public ArrayType(DataType elementType, List<? extends ArrayDimension> shape) {
        if (elementType == null || elementType instanceof ArrayType) {
            throw new IllegalArgumentException(String.format(
                    "ArrayType expected 'datatype' argument to be a scalar, deferred or unsupported "
                            + "type but found '%s'.", elementType));
        }
        if (shape == null) {
            throw new IllegalArgumentException("ArrayType expected 'shape' argument to be a list but found 'null'.");
        }
        if (shape.isEmpty()) {
            throw new IllegalArgumentException("ArrayType expected 'shape' argument to have at least one dimension.");
        }
        for (ArrayDimension dimension : shape) {
            if (dimension == null) {
                throw new IllegalArgumentException("ArrayType shape entries must not be null: " + shape);
            }
        }
        this.elementType = elementType;
        this.shape = Collections.unmodifiableList(new ArrayList<>(shape));
    }

    public DataType getElementType() {
        return elementType;
    }

    public List<ArrayDimension> getShape() {
        return shape;
    }

    public int getRank() {
        return shape.size();
    }

    /**
     * Copies the element type deeply and the shape list shallowly; symbols used as extents are shared.
     */
    @Override
    public ArrayType copy() {
        return new ArrayType(elementType.copy(), new ArrayList<>(shape));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayType other)) return false;
        return elementType.equals(other.elementType) && shape.equals(other.shape);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementType, shape);
    }

    @Override
    public String toString() {
        return "Array<" + elementType + ", shape=" + shape + ">";
    }
}
