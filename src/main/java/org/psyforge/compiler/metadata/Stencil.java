package org.psyforge.compiler.metadata;

import org.psyforge.compiler.api.MetadataParseException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The stencil of a field access: either a named stencil such as {@code go_pointwise}, or an
 * explicit 3x3 extent such as {@code go_stencil(000,011,000)}.
 *
 * @param name The stencil name, or the stencil constructor name for an explicit extent.
 * @param rows The three rows of an explicit extent; empty for a named stencil.
 */
public record Stencil(String name, List<String> rows) {

    private static final Pattern ROW = Pattern.compile("[01]{3}");

    public Stencil {
        rows = List.copyOf(rows);
    }

    public static Stencil named(String name) {
        return new Stencil(name, List.of());
    }

    /**
     * @param constructor The stencil constructor name.
     * @param rows Exactly three rows of three '0'/'1' characters.
     * @return The explicit stencil.
     */
    public static Stencil explicit(String constructor, List<String> rows) {
        for (String row : rows) {
            if (!ROW.matcher(row).matches()) {
                throw new MetadataParseException(
                        "Stencil entries must be 3 characters drawn from '0' or '1' but found '" + row + "'.");
            }
        }
        if (rows.size() != 3) {
            throw new MetadataParseException(String.format(
                    "Expected 3 stencil entries in '%s(%s)' but found %d.", constructor, String.join(",", rows), rows.size()));
        }
        return new Stencil(constructor, rows);
    }

    public boolean isExplicit() {
        return !rows.isEmpty();
    }

    public String toFortranString() {
        return isExplicit() ? name + "(" + String.join(",", rows) + ")" : name;
    }
}
