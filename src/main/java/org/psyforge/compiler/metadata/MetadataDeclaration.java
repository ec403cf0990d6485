package org.psyforge.compiler.metadata;

import java.util.List;

/**
 * The syntactic content of a kernel metadata declaration, before any vocabulary checks.
 *
 * @param source The declaration text.
 * @param typeName The name of the derived type.
 * @param components The component declarations, in source order.
 * @param componentText The source text of all component declarations, used in error messages.
 * @param hasContains Whether a {@code contains} clause is present.
 * @param bindings The procedure bindings after {@code contains}.
 */
record MetadataDeclaration(String source, String typeName, List<Component> components, String componentText,
                           boolean hasContains, List<Binding> bindings) {

    /**
     * One entry of an argument constructor, e.g. {@code go_cu}, {@code w0*3} or {@code go_stencil(000,011,000)}.
     *
     * @param head The leading name.
     * @param inner The parenthesised values, or null if there are none.
     * @param multiplier The text after '*', or null.
     * @param text The entry as written, without spaces.
     */
    record Entry(String head, List<String> inner, String multiplier, String text) {
    }

    /**
     * @param constructor The constructor name, e.g. {@code go_arg}.
     * @param entries The entries in order.
     * @param text A normalised rendering, e.g. {@code go_arg(a, b, c)}.
     */
    record RawArgument(String constructor, List<Entry> entries, String text) {
    }

    /**
     * A component declaration such as {@code integer :: iterates_over = go_all_pts}.
     *
     * @param name The component name.
     * @param dimension The {@code dimension(N)} value token, or null.
     * @param value The initial value if it is a single name, else null.
     * @param arguments The argument constructors if the value is an array constructor, else null.
     * @param argumentsStart The offset just after the array constructor's opening bracket.
     * @param argumentsEnd The offset of the array constructor's closing bracket.
     */
    record Component(String name, MetadataToken dimension, MetadataToken value, List<RawArgument> arguments,
                     int argumentsStart, int argumentsEnd) {
    }

    /**
     * @param name The binding name, e.g. {@code code}.
     * @param target The name of the bound procedure.
     */
    record Binding(String name, MetadataToken target) {
    }
}
