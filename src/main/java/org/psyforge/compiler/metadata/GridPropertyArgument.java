package org.psyforge.compiler.metadata;

import java.util.List;

/**
 * A grid property passed to a kernel, e.g. {@code go_arg(go_read, go_grid_area_t)}.
 */
public record GridPropertyArgument(String access, String gridProperty) implements ArgumentDescriptor {

    @Override
    public List<String> entries() {
        return List.of(access, gridProperty);
    }
}
