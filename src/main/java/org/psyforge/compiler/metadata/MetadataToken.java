package org.psyforge.compiler.metadata;

/**
 * A token of a kernel metadata declaration.
 *
 * @param type The token type.
 * @param text The exact source text.
 * @param start The offset of the first character in the declaration text.
 * @param end The offset after the last character.
 * @param line The 1-based line.
 */
public record MetadataToken(MetadataTokenType type, String text, int start, int end, int line) {
}
