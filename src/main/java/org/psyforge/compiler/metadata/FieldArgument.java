package org.psyforge.compiler.metadata;

import java.util.List;

/**
 * A field on a function space, e.g. {@code go_arg(go_write, go_cu, go_pointwise)}.
 */
public record FieldArgument(String access, String functionSpace, Stencil stencil) implements ArgumentDescriptor {

    @Override
    public List<String> entries() {
        return List.of(access, functionSpace, stencil.toFortranString());
    }
}
