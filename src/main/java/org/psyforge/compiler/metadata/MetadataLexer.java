package org.psyforge.compiler.metadata;

import org.psyforge.compiler.api.MetadataParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a kernel metadata declaration into tokens. Every token keeps its character span so that
 * values can later be replaced in the original text. Comments and line continuations are skipped.
 */
public class MetadataLexer {

    private final String source;
    private final List<MetadataToken> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;

    public MetadataLexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the whole declaration.
     * @return The tokens, terminated by {@link MetadataTokenType#END_OF_FILE}.
     * @throws MetadataParseException on a character that cannot start a token.
     */
    public List<MetadataToken> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new MetadataToken(MetadataTokenType.END_OF_FILE, "", current, current, line));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ',': addToken(MetadataTokenType.COMMA); break;
            case ')': addToken(MetadataTokenType.RIGHT_PAREN); break;
            case '[': addToken(MetadataTokenType.LEFT_BRACKET); break;
            case ']': addToken(MetadataTokenType.RIGHT_BRACKET); break;
            case '*': addToken(MetadataTokenType.STAR); break;
            case '(':
                addToken(match('/') ? MetadataTokenType.ARRAY_OPEN : MetadataTokenType.LEFT_PAREN);
                break;
            case '/':
                if (!match(')')) {
                    throw error("Unexpected character '/'");
                }
                addToken(MetadataTokenType.ARRAY_CLOSE);
                break;
            case ':':
                if (!match(':')) {
                    throw error("Unexpected character ':'");
                }
                addToken(MetadataTokenType.DOUBLE_COLON);
                break;
            case '=':
                addToken(match('>') ? MetadataTokenType.ARROW : MetadataTokenType.EQUALS);
                break;
            case '!':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '&':
                continuation();
                break;
            case ' ', '\r', '\t':
                break;
            case '\n':
                addToken(MetadataTokenType.NEWLINE);
                line++;
                break;
            default:
                if (isDigit(c)) {
                    while (isDigit(peek())) advance();
                    addToken(MetadataTokenType.INTEGER);
                } else if (isAlpha(c)) {
                    while (isAlphaNumeric(peek())) advance();
                    addToken(MetadataTokenType.IDENTIFIER);
                } else {
                    throw error("Unexpected character '" + c + "'");
                }
                break;
        }
    }

    /**
     * Skips the rest of a continued line, the line break and an optional leading '&' on the next line.
     */
    private void continuation() {
        while (!isAtEnd() && peek() != '\n') {
            char c = advance();
            if (c == '!') {
                while (peek() != '\n' && !isAtEnd()) advance();
            } else if (c != ' ' && c != '\t' && c != '\r') {
                throw error("Unexpected text after a line continuation");
            }
        }
        if (!isAtEnd()) {
            advance();
            line++;
        }
        while (peek() == ' ' || peek() == '\t') advance();
        if (peek() == '&') advance();
    }

    private MetadataParseException error(String message) {
        return new MetadataParseException(String.format("%s at line %d of the kernel metadata.", message, line));
    }

    private void addToken(MetadataTokenType type) {
        tokens.add(new MetadataToken(type, source.substring(start, current), start, current, line));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
