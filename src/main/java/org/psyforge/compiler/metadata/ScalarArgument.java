package org.psyforge.compiler.metadata;

import java.util.List;

/**
 * A scalar passed by value, e.g. {@code go_arg(go_read, go_r_scalar, go_pointwise)}.
 */
public record ScalarArgument(String access, String datatype, Stencil stencil) implements ArgumentDescriptor {

    @Override
    public List<String> entries() {
        return List.of(access, datatype, stencil.toFortranString());
    }
}
