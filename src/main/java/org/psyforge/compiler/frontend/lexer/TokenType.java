package org.psyforge.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link FortranLexer} can recognize.
 */
public enum TokenType {
    // Punctuation.
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    COLON,
    /** {@code ::} between the attributes and the names of a declaration. */
    DOUBLE_COLON,
    /** {@code %}, the component selector. */
    PERCENT,
    /** {@code =>}, used in renames and pointer assignments. */
    ARROW,

    // Operators.
    PLUS,
    MINUS,
    STAR,
    /** {@code **}. */
    POWER,
    SLASH,
    /** {@code //}. */
    CONCAT,
    EQUALS,
    EQUAL_EQUAL,
    NOT_EQUAL,
    LESS,
    LESS_EQUAL,
    GREATER,
    GREATER_EQUAL,
    /** A dotted operator or logical constant such as {@code .and.} or {@code .true.}; the value is the lower-case word. */
    DOT_OPERATOR,

    // Literals.
    /** A name; Fortran keywords are not reserved and are recognized by the reader. */
    IDENTIFIER,
    /** An integer literal, possibly with a kind suffix ({@code 1_i_def}). */
    INTEGER,
    /** A real literal, possibly with an exponent and a kind suffix ({@code 1.0e-3_r_def}). */
    REAL,
    /** A character literal; the value is the content without quotes. */
    STRING,

    // Miscellaneous.
    /** The end of a statement: a line end that is not continued, or a semicolon. */
    NEWLINE,
    /** Represents the end of the source file. */
    END_OF_FILE
}
