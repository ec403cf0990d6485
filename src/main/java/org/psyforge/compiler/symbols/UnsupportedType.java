package org.psyforge.compiler.symbols;

/**
 * A type the IR does not model. The original declaration is kept so that it can be written back.
 *
 * @param declaration The Fortran declaration text, e.g. {@code type(ProfileData), save}.
 */
public record UnsupportedType(String declaration) implements DataType {

    public UnsupportedType {
        if (declaration == null || declaration.isBlank()) {
            throw new IllegalArgumentException("UnsupportedType requires the original declaration text.");
        }
    }

    @Override
    public UnsupportedType copy() {
        return new UnsupportedType(declaration);
    }
}
