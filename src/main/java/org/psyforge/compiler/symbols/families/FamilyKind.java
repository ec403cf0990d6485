package org.psyforge.compiler.symbols.families;

/**
 * The shape of the symbols a {@link TypeFamily} generates.
 */
public enum FamilyKind {
    SCALAR,
    ARRAY,
    VECTOR
}
