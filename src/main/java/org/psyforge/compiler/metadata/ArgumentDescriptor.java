package org.psyforge.compiler.metadata;

import java.util.List;

/**
 * One entry of a kernel's {@code meta_args} list. The category is implied by the number of
 * entries: 2 for a grid property, 3 for a field, field vector or scalar and 5 for an operator.
 * All values are held in lower case.
 */
public sealed interface ArgumentDescriptor
        permits GridPropertyArgument, FieldArgument, FieldVectorArgument, ScalarArgument, OperatorArgument {

    /**
     * @return The access mode, e.g. {@code go_read}.
     */
    String access();

    /**
     * @return The textual entries of the argument constructor, in order.
     */
    List<String> entries();

    /**
     * @param constructor The name of the argument constructor, e.g. {@code go_arg}.
     * @return The argument as it is written in the metadata.
     */
    default String toFortranString(String constructor) {
        return constructor + "(" + String.join(", ", entries()) + ")";
    }
}
