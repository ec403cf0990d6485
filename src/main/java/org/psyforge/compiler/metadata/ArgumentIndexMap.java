package org.psyforge.compiler.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the positions of a kernel's call arguments to the {@code meta_args} entries they come from.
 * <p>
 * A field vector of size n takes n consecutive positions; every other argument takes one. Positions
 * of arguments with no metadata entry, such as a cell map or a stencil extent, can be skipped and
 * have no mapping.
 */
public final class ArgumentIndexMap {

    private final Map<Integer, Integer> metadataIndices;

    private ArgumentIndexMap(Map<Integer, Integer> metadataIndices) {
        this.metadataIndices = Collections.unmodifiableMap(metadataIndices);
    }

    /**
     * @param arguments The {@code meta_args} entries in order.
     * @return The map of a call that passes exactly these arguments.
     */
    public static ArgumentIndexMap of(List<ArgumentDescriptor> arguments) {
        Builder builder = builder();
        for (int i = 0; i < arguments.size(); i++) {
            builder.add(arguments.get(i), i);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param argumentIndex A call argument position, counted from 0.
     * @return The index of the {@code meta_args} entry, or -1 if the position has none.
     */
    public int metadataIndex(int argumentIndex) {
        return metadataIndices.getOrDefault(argumentIndex, -1);
    }

    /**
     * @return Call argument position to {@code meta_args} index, in position order.
     */
    public Map<Integer, Integer> asMap() {
        return metadataIndices;
    }

    /**
     * Adds the call arguments in the order the call passes them.
     */
    public static final class Builder {

        private final Map<Integer, Integer> metadataIndices = new LinkedHashMap<>();
        private int position;

        private Builder() {
        }

        /**
         * @param argument A {@code meta_args} entry.
         * @param metadataIndex Its index in {@code meta_args}.
         * @return This builder.
         */
        public Builder add(ArgumentDescriptor argument, int metadataIndex) {
            if (metadataIndex < 0) {
                throw new IllegalArgumentException("A metadata index must not be negative but found " + metadataIndex + ".");
            }
            int positions = argument instanceof FieldVectorArgument vector ? vector.vectorSize() : 1;
            for (int i = 0; i < positions; i++) {
                metadataIndices.put(position++, metadataIndex);
            }
            return this;
        }

        /**
         * @param positions The number of call arguments with no metadata entry.
         * @return This builder.
         */
        public Builder skip(int positions) {
            if (positions < 0) {
                throw new IllegalArgumentException("Cannot skip a negative number of arguments: " + positions + ".");
            }
            position += positions;
            return this;
        }

        public ArgumentIndexMap build() {
            return new ArgumentIndexMap(new LinkedHashMap<>(metadataIndices));
        }
    }
}
