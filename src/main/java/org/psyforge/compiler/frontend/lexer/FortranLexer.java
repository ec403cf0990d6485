package org.psyforge.compiler.frontend.lexer;

import org.psyforge.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Converts free-form Fortran source into tokens. Comments are dropped, continuation lines are
 * joined and every statement is terminated by a {@link TokenType#NEWLINE} token.
 */
public class FortranLexer {

    private static final Set<String> DOT_WORDS = Set.of(
            "eq", "ne", "lt", "le", "gt", "ge", "and", "or", "not", "eqv", "neqv", "true", "false");

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    /**
     * Creates a new lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public FortranLexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being read, for error reporting.
     */
    public FortranLexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return The recognized tokens, ending with {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE) {
            tokens.add(new Token(TokenType.NEWLINE, "", null, line, column(), logicalFileName));
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column(), logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case ',': addToken(TokenType.COMMA); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case ':': addToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON); break;
            case '*': addToken(match('*') ? TokenType.POWER : TokenType.STAR); break;
            case '/':
                if (match('/')) {
                    addToken(TokenType.CONCAT);
                } else {
                    addToken(match('=') ? TokenType.NOT_EQUAL : TokenType.SLASH);
                }
                break;
            case '=':
                if (match('=')) {
                    addToken(TokenType.EQUAL_EQUAL);
                } else {
                    addToken(match('>') ? TokenType.ARROW : TokenType.EQUALS);
                }
                break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '\'', '"': string(c); break;
            case '!':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '#':
                if (current - 1 == lineStart) {
                    diagnostics.reportWarning("Preprocessor directive ignored.", logicalFileName, line, column());
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    diagnostics.reportError("Unexpected character: " + c, logicalFileName, line, column());
                }
                break;
            case '&': continuation(); break;
            case ';': endStatement(); break;
            case ' ', '\r', '\t':
                break;
            case '\n':
                endStatement();
                newLine();
                break;
            case '.':
                if (isDigit(peek())) {
                    number();
                } else {
                    dotOperator();
                }
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    diagnostics.reportError("Unexpected character: " + c, logicalFileName, line, column());
                }
                break;
        }
    }

    /**
     * Skips the rest of a continued line, any comment lines, and the optional {@code &} that starts the next line.
     */
    private void continuation() {
        while (peek() != '\n' && !isAtEnd()) {
            char c = advance();
            if (c == '!') {
                while (peek() != '\n' && !isAtEnd()) advance();
            } else if (c != ' ' && c != '\t' && c != '\r') {
                diagnostics.reportError("Only a comment may follow a continuation character '&'.", logicalFileName, line, column());
            }
        }
        while (!isAtEnd()) {
            advance();
            newLine();
            int lookahead = current;
            while (lookahead < source.length() && (source.charAt(lookahead) == ' ' || source.charAt(lookahead) == '\t'
                    || source.charAt(lookahead) == '\r')) {
                lookahead++;
            }
            if (lookahead < source.length() && (source.charAt(lookahead) == '\n' || source.charAt(lookahead) == '!')) {
                current = lookahead;
                while (peek() != '\n' && !isAtEnd()) advance();
                continue;
            }
            current = lookahead;
            if (peek() == '&') {
                advance();
            }
            return;
        }
    }

    private void endStatement() {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE) {
            tokens.add(new Token(TokenType.NEWLINE, "", null, line, column(), logicalFileName));
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        TokenType type = TokenType.INTEGER;
        while (isDigit(peek())) advance();
        if (source.charAt(start) == '.') {
            type = TokenType.REAL;
        } else if (peek() == '.' && !startsDotWord(current + 1)) {
            advance();
            type = TokenType.REAL;
        }
        while (isDigit(peek())) advance();
        char e = Character.toLowerCase(peek());
        if ((e == 'e' || e == 'd') && (isDigit(peekNext())
                || ((peekNext() == '+' || peekNext() == '-') && current + 2 < source.length()
                && isDigit(source.charAt(current + 2))))) {
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
            type = TokenType.REAL;
        }
        if (peek() == '_' && isAlphaNumeric(peekNext())) {
            advance();
            while (isAlphaNumeric(peek())) advance();
        }
        addToken(type);
    }

    private void dotOperator() {
        while (isAlpha(peek())) advance();
        if (peek() != '.') {
            diagnostics.reportError("Unterminated dotted operator: " + source.substring(start, current),
                    logicalFileName, line, column());
            return;
        }
        advance();
        String word = source.substring(start + 1, current - 1).toLowerCase(Locale.ROOT);
        if (!DOT_WORDS.contains(word)) {
            diagnostics.reportError("Unknown operator: " + source.substring(start, current), logicalFileName, line, column());
            return;
        }
        addToken(TokenType.DOT_OPERATOR, word);
    }

    private boolean startsDotWord(int position) {
        int end = position;
        while (end < source.length() && Character.isLetter(source.charAt(end))) end++;
        return end > position && end < source.length() && source.charAt(end) == '.'
                && DOT_WORDS.contains(source.substring(position, end).toLowerCase(Locale.ROOT));
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '\n') {
            char c = advance();
            if (c == quote) {
                if (peek() == quote) {
                    advance();
                } else {
                    addToken(TokenType.STRING, value.toString());
                    return;
                }
            }
            value.append(c);
        }
        diagnostics.reportError("Unterminated string.", logicalFileName, line, column());
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, line, start - lineStart + 1, logicalFileName));
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private int column() {
        return current - lineStart + 1;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
