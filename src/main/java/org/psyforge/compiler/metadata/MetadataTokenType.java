package org.psyforge.compiler.metadata;

/**
 * The token types of the kernel metadata declaration syntax.
 */
public enum MetadataTokenType {
    // Punctuation.
    /** ',' */
    COMMA,
    /** '(' */
    LEFT_PAREN,
    /** ')' */
    RIGHT_PAREN,
    /** '(/', opening an array constructor. */
    ARRAY_OPEN,
    /** '/)', closing an array constructor. */
    ARRAY_CLOSE,
    /** '[' */
    LEFT_BRACKET,
    /** ']' */
    RIGHT_BRACKET,
    /** '::' */
    DOUBLE_COLON,
    /** '=' */
    EQUALS,
    /** '=>' in a procedure binding. */
    ARROW,
    /** '*' in a field vector stagger. */
    STAR,

    // Literals.
    /** A Fortran name. */
    IDENTIFIER,
    /** A digit string, kept verbatim (stencil rows keep their leading zeros). */
    INTEGER,

    // Miscellaneous.
    /** The end of a statement. Continued lines do not produce one. */
    NEWLINE,
    /** The end of the declaration. */
    END_OF_FILE
}
