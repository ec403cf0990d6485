package org.psyforge.compiler.metadata;

import java.util.List;

/**
 * A vector of fields on one function space, written {@code <space>*<n>}.
 */
public record FieldVectorArgument(String access, String functionSpace, int vectorSize, Stencil stencil)
        implements ArgumentDescriptor {

    public FieldVectorArgument {
        if (vectorSize < 1) {
            throw new IllegalArgumentException("The vector size of a field vector argument must be positive but found " + vectorSize + ".");
        }
    }

    @Override
    public List<String> entries() {
        return List.of(access, functionSpace + "*" + vectorSize, stencil.toFortranString());
    }
}
