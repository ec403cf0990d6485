package org.psyforge.compiler.metadata;

import org.psyforge.compiler.api.MetadataParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the tokens of a kernel metadata declaration into a {@link MetadataDeclaration}:
 * <pre>
 * type[, attr...] :: name
 *    component...
 * contains
 *    procedure[, attr...] :: binding => target
 * end type [name]
 * </pre>
 * Only the syntax is checked here; the values are validated by {@link MetadataValidator}.
 */
class MetadataParser {

    private final String source;
    private final List<MetadataToken> tokens;
    private int current = 0;

    MetadataParser(String source) {
        this.source = source;
        this.tokens = new MetadataLexer(source).scanTokens();
    }

    /**
     * @return The parsed declaration.
     * @throws MetadataParseException if the text is not a derived-type declaration.
     */
    MetadataDeclaration parse() {
        skipNewlines();
        consumeKeyword("type", "Expected the kernel metadata to start with 'type'");
        while (!check(MetadataTokenType.DOUBLE_COLON)) {
            if (check(MetadataTokenType.NEWLINE) || isAtEnd()) {
                throw error("Expected '::' in the kernel metadata type declaration");
            }
            advance();
        }
        advance();
        String typeName = consume(MetadataTokenType.IDENTIFIER, "Expected the name of the kernel metadata type").text();
        endOfStatement();

        List<MetadataDeclaration.Component> components = new ArrayList<>();
        int componentsStart = -1;
        int componentsEnd = -1;
        skipNewlines();
        while (!isAtEnd() && !checkKeyword("contains") && !checkKeyword("end")) {
            int statementStart = peek().start();
            components.add(component());
            if (componentsStart < 0) {
                componentsStart = statementStart;
            }
            componentsEnd = previous().end();
            endOfStatement();
            skipNewlines();
        }
        String componentText = componentsStart < 0 ? "" : source.substring(componentsStart, componentsEnd);

        boolean hasContains = false;
        List<MetadataDeclaration.Binding> bindings = new ArrayList<>();
        if (matchKeyword("contains")) {
            hasContains = true;
            endOfStatement();
            skipNewlines();
            while (!isAtEnd() && !checkKeyword("end")) {
                bindings.add(binding());
                endOfStatement();
                skipNewlines();
            }
        }
        consumeKeyword("end", "Expected 'end type' at the end of the kernel metadata");
        consumeKeyword("type", "Expected 'end type' at the end of the kernel metadata");
        if (check(MetadataTokenType.IDENTIFIER) && !advance().text().equalsIgnoreCase(typeName)) {
            throw error("The 'end type' name does not match '" + typeName + "'");
        }
        skipNewlines();
        if (!isAtEnd()) {
            throw error("Unexpected text after 'end type'");
        }
        return new MetadataDeclaration(source, typeName, List.copyOf(components), componentText, hasContains,
                List.copyOf(bindings));
    }

    private MetadataDeclaration.Component component() {
        consume(MetadataTokenType.IDENTIFIER, "Expected a component type");
        if (check(MetadataTokenType.LEFT_PAREN)) {
            skipParenthesised();
        }
        MetadataToken dimension = null;
        while (match(MetadataTokenType.COMMA)) {
            MetadataToken attribute = consume(MetadataTokenType.IDENTIFIER, "Expected a component attribute");
            if (attribute.text().equalsIgnoreCase("dimension")) {
                consume(MetadataTokenType.LEFT_PAREN, "Expected '(' after 'dimension'");
                dimension = consume(MetadataTokenType.INTEGER, "Expected an integer extent in 'dimension'");
                consume(MetadataTokenType.RIGHT_PAREN, "Expected ')' after the 'dimension' extent");
            } else if (check(MetadataTokenType.LEFT_PAREN)) {
                skipParenthesised();
            }
        }
        consume(MetadataTokenType.DOUBLE_COLON, "Expected '::' in a component declaration");
        String name = consume(MetadataTokenType.IDENTIFIER, "Expected a component name").text().toLowerCase(Locale.ROOT);
        consume(MetadataTokenType.EQUALS, "Expected '=' after component '" + name + "'");

        if (match(MetadataTokenType.ARRAY_OPEN, MetadataTokenType.LEFT_BRACKET)) {
            MetadataTokenType closing = previous().type() == MetadataTokenType.ARRAY_OPEN
                    ? MetadataTokenType.ARRAY_CLOSE : MetadataTokenType.RIGHT_BRACKET;
            int argumentsStart = previous().end();
            List<MetadataDeclaration.RawArgument> arguments = new ArrayList<>();
            if (!check(closing)) {
                do {
                    arguments.add(argument());
                } while (match(MetadataTokenType.COMMA));
            }
            int argumentsEnd = consume(closing, "Expected the end of the array constructor of '" + name + "'").start();
            return new MetadataDeclaration.Component(name, dimension, null, List.copyOf(arguments), argumentsStart, argumentsEnd);
        }
        MetadataToken value = consume(MetadataTokenType.IDENTIFIER, "Expected a name as the value of '" + name + "'");
        return new MetadataDeclaration.Component(name, dimension, value, null, -1, -1);
    }

    private MetadataDeclaration.RawArgument argument() {
        String constructor = consume(MetadataTokenType.IDENTIFIER, "Expected a metadata argument").text();
        consume(MetadataTokenType.LEFT_PAREN, "Expected '(' after '" + constructor + "'");
        List<MetadataDeclaration.Entry> entries = new ArrayList<>();
        do {
            entries.add(entry());
        } while (match(MetadataTokenType.COMMA));
        consume(MetadataTokenType.RIGHT_PAREN, "Expected ')' to close '" + constructor + "'");
        List<String> texts = entries.stream().map(MetadataDeclaration.Entry::text).toList();
        return new MetadataDeclaration.RawArgument(constructor, List.copyOf(entries),
                constructor + "(" + String.join(", ", texts) + ")");
    }

    private MetadataDeclaration.Entry entry() {
        String head = consume(MetadataTokenType.IDENTIFIER, "Expected a name in a metadata argument").text();
        if (match(MetadataTokenType.STAR)) {
            String multiplier = consume(MetadataTokenType.INTEGER, "Expected a vector size after '" + head + "*'").text();
            return new MetadataDeclaration.Entry(head, null, multiplier, head + "*" + multiplier);
        }
        if (match(MetadataTokenType.LEFT_PAREN)) {
            List<String> inner = new ArrayList<>();
            do {
                if (!check(MetadataTokenType.INTEGER) && !check(MetadataTokenType.IDENTIFIER)) {
                    throw error("Expected a value inside '" + head + "(...)'");
                }
                inner.add(advance().text());
            } while (match(MetadataTokenType.COMMA));
            consume(MetadataTokenType.RIGHT_PAREN, "Expected ')' to close '" + head + "'");
            return new MetadataDeclaration.Entry(head, List.copyOf(inner), null,
                    head + "(" + String.join(",", inner) + ")");
        }
        return new MetadataDeclaration.Entry(head, null, null, head);
    }

    private MetadataDeclaration.Binding binding() {
        consumeKeyword("procedure", "Expected a procedure binding after 'contains'");
        while (match(MetadataTokenType.COMMA)) {
            consume(MetadataTokenType.IDENTIFIER, "Expected a binding attribute");
        }
        consume(MetadataTokenType.DOUBLE_COLON, "Expected '::' in a procedure binding");
        String name = consume(MetadataTokenType.IDENTIFIER, "Expected a binding name").text();
        consume(MetadataTokenType.ARROW, "Expected '=>' in the binding of '" + name + "'");
        MetadataToken target = consume(MetadataTokenType.IDENTIFIER, "Expected a procedure name after '=>'");
        return new MetadataDeclaration.Binding(name.toLowerCase(Locale.ROOT), target);
    }

    private void skipParenthesised() {
        consume(MetadataTokenType.LEFT_PAREN, "Expected '('");
        int depth = 1;
        while (depth > 0) {
            if (isAtEnd() || check(MetadataTokenType.NEWLINE)) {
                throw error("Unbalanced parentheses");
            }
            MetadataTokenType type = advance().type();
            if (type == MetadataTokenType.LEFT_PAREN) depth++;
            if (type == MetadataTokenType.RIGHT_PAREN) depth--;
        }
    }

    private void endOfStatement() {
        if (!isAtEnd()) {
            consume(MetadataTokenType.NEWLINE, "Expected the end of the statement but found '" + peek().text() + "'");
        }
    }

    private void skipNewlines() {
        while (match(MetadataTokenType.NEWLINE)) {
            // nothing
        }
    }

    private boolean checkKeyword(String keyword) {
        return check(MetadataTokenType.IDENTIFIER) && peek().text().equalsIgnoreCase(keyword);
    }

    private boolean matchKeyword(String keyword) {
        if (checkKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private void consumeKeyword(String keyword, String errorMessage) {
        if (!matchKeyword(keyword)) {
            throw error(errorMessage);
        }
    }

    private boolean match(MetadataTokenType... types) {
        for (MetadataTokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(MetadataTokenType type) {
        return peek().type() == type;
    }

    private MetadataToken advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == MetadataTokenType.END_OF_FILE;
    }

    private MetadataToken peek() {
        return tokens.get(current);
    }

    private MetadataToken previous() {
        return tokens.get(current - 1);
    }

    private MetadataToken consume(MetadataTokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(errorMessage);
    }

    private MetadataParseException error(String message) {
        MetadataToken token = peek();
        String found = token.type() == MetadataTokenType.END_OF_FILE ? "the end of the text"
                : token.type() == MetadataTokenType.NEWLINE ? "the end of the line" : "'" + token.text() + "'";
        return new MetadataParseException(String.format("%s, but found %s at line %d of the kernel metadata.",
                message, found, token.line()));
    }
}
