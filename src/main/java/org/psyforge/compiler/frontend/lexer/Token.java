package org.psyforge.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link FortranLexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param value The processed value: the lower-case word of a dotted operator, the content of a string, otherwise null.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name of the source.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * @param keyword A Fortran keyword in lower case.
     * @return true if this is a name token spelling that keyword, ignoring case.
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.IDENTIFIER && text.equalsIgnoreCase(keyword);
    }
}
