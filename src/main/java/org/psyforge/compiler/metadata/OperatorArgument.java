package org.psyforge.compiler.metadata;

import java.util.List;

/**
 * An operator mapping a field on {@code fromSpace} to a field on {@code toSpace}, written
 * {@code arg_type(access, form, datatype, to, from)}.
 */
public record OperatorArgument(String access, String form, String datatype, String toSpace, String fromSpace)
        implements ArgumentDescriptor {

    @Override
    public List<String> entries() {
        return List.of(access, form, datatype, toSpace, fromSpace);
    }
}
