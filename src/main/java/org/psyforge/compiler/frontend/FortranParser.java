package org.psyforge.compiler.frontend;

import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.api.PsyirException;
import org.psyforge.compiler.diagnostics.CompilerLogger;
import org.psyforge.compiler.diagnostics.DiagnosticsEngine;
import org.psyforge.compiler.frontend.lexer.Token;
import org.psyforge.compiler.frontend.lexer.TokenType;
import org.psyforge.compiler.ir.ArrayReference;
import org.psyforge.compiler.ir.Assignment;
import org.psyforge.compiler.ir.BinaryOperation;
import org.psyforge.compiler.ir.Call;
import org.psyforge.compiler.ir.CodeBlock;
import org.psyforge.compiler.ir.Container;
import org.psyforge.compiler.ir.IfBlock;
import org.psyforge.compiler.ir.IntrinsicCall;
import org.psyforge.compiler.ir.Literal;
import org.psyforge.compiler.ir.Loop;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.Range;
import org.psyforge.compiler.ir.Reference;
import org.psyforge.compiler.ir.Return;
import org.psyforge.compiler.ir.Routine;
import org.psyforge.compiler.ir.StructureReference;
import org.psyforge.compiler.ir.UnaryOperation;
import org.psyforge.compiler.symbols.ArgumentInterface;
import org.psyforge.compiler.symbols.ArrayDimension;
import org.psyforge.compiler.symbols.ArrayType;
import org.psyforge.compiler.symbols.BytePrecision;
import org.psyforge.compiler.symbols.ContainerSymbol;
import org.psyforge.compiler.symbols.DataSymbol;
import org.psyforge.compiler.symbols.DataType;
import org.psyforge.compiler.symbols.DeferredType;
import org.psyforge.compiler.symbols.ImportInterface;
import org.psyforge.compiler.symbols.LiteralExtent;
import org.psyforge.compiler.symbols.LocalInterface;
import org.psyforge.compiler.symbols.PrecisionSpec;
import org.psyforge.compiler.symbols.RoutineSymbol;
import org.psyforge.compiler.symbols.ScalarType;
import org.psyforge.compiler.symbols.Symbol;
import org.psyforge.compiler.symbols.SymbolExtent;
import org.psyforge.compiler.symbols.SymbolInterface;
import org.psyforge.compiler.symbols.SymbolPrecision;
import org.psyforge.compiler.symbols.SymbolTable;
import org.psyforge.compiler.symbols.TypeSymbol;
import org.psyforge.compiler.symbols.UnresolvedInterface;
import org.psyforge.compiler.symbols.UnsupportedType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Recursive-descent parser for the supported Fortran subset. It consumes the tokens of the
 * {@link org.psyforge.compiler.frontend.lexer.FortranLexer} and builds the IR directly.
 * <p>
 * Statements and program units the IR does not model are kept verbatim as {@link CodeBlock}s.
 * Syntax errors are reported to the {@link DiagnosticsEngine}; the affected statement is kept as a
 * code block too, so that one bad line does not stop the rest of the file from being read.
 */
class FortranParser {

    private static final Set<String> UNIT_KEYWORDS = Set.of("subroutine", "function", "program", "module", "submodule");
    private static final Set<String> CONSTRUCT_KEYWORDS = Set.of(
            "do", "if", "select", "where", "forall", "associate", "block", "critical");
    private static final Set<String> TYPE_KEYWORDS = Set.of(
            "integer", "real", "logical", "character", "complex", "double", "type", "class");

    /** Malformed input; already reported when thrown. */
    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message);
        }
    }

    /** Well-formed input that the IR does not model. */
    private static final class UnsupportedSyntax extends RuntimeException {
        UnsupportedSyntax(String message) {
            super(message);
        }
    }

    /** One entry of a dimension list, classified for the conversion into an array shape. */
    private record Dimension(Kind kind, String text) {
        enum Kind { COLON, LITERAL, NAME, OTHER }
    }

    private final List<Token> tokens;
    private final List<String> sourceLines;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private final Deque<SymbolTable> scopes = new ArrayDeque<>();
    private int current = 0;

    /**
     * @param tokens The tokens of the whole source.
     * @param source The source text, used to keep unsupported code verbatim.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param fileName The logical file name for reporting.
     */
    FortranParser(List<Token> tokens, String source, DiagnosticsEngine diagnostics, String fileName) {
        this.tokens = tokens;
        this.sourceLines = List.of(source.split("\n", -1));
        this.diagnostics = diagnostics;
        this.fileName = fileName;
    }

    /**
     * Parses all program units of a file.
     * @param name The name of the file container.
     * @return The file container holding modules, routines and unsupported units.
     */
    Container parseFile(String name) {
        Container file = new Container(name);
        scopes.push(file.getSymbolTable());
        try {
            while (!isAtEnd()) {
                if (match(TokenType.NEWLINE)) {
                    continue;
                }
                parseUnit(file);
            }
        } finally {
            scopes.pop();
        }
        return file;
    }

    /**
     * Parses a single expression against an existing scope.
     *
     * @param table The scope names are resolved in.
     * @return The expression, or an expression code block if it uses unsupported syntax.
     * @throws GenerationException if the text is not a valid expression; the problem has been reported.
     */
    Node parseStandaloneExpression(SymbolTable table) {
        scopes.push(table);
        int start = current;
        try {
            Node expression = expression();
            endOfStatement();
            if (!isAtEnd()) {
                throw error(peek(), "Expected a single expression but found more text at '" + peek().text() + "'.");
            }
            return expression;
        } catch (UnsupportedSyntax e) {
            CompilerLogger.debug("Expression kept as a code block: {}", e.getMessage());
            return codeBlock(start, tokens.size() - 1, CodeBlock.Structure.EXPRESSION);
        } catch (ParseError e) {
            throw new GenerationException("Failed to parse expression: " + e.getMessage(), e);
        } finally {
            scopes.pop();
        }
    }

    // ------------------------------------------------------------------ program units

    private void parseUnit(Container parent) {
        int start = current;
        try {
            if (checkKeyword("module") && !checkNextKeyword("procedure") && parent.getParent() == null
                    && scopes.size() == 1) {
                parseModule(parent);
            } else if (checkKeyword("subroutine")) {
                parseRoutine(parent, false);
            } else if (checkKeyword("program")) {
                parseRoutine(parent, true);
            } else {
                parent.addChild(unitCodeBlock());
            }
        } catch (ParseError | UnsupportedSyntax | PsyirException e) {
            CompilerLogger.debug("Program unit at line {} kept as a code block: {}", tokens.get(start).line(), e.getMessage());
            current = start;
            parent.addChild(unitCodeBlock());
        }
    }

    private void parseModule(Container file) {
        advance();
        Token name = consume(TokenType.IDENTIFIER, "Expected a module name.");
        endOfStatement();
        Container module = new Container(name.text());
        scopes.push(module.getSymbolTable());
        try {
            parseSpecification(List.of());
            skipNewlines();
            if (matchKeyword("contains")) {
                endOfStatement();
                while (true) {
                    skipNewlines();
                    if (isAtEnd()) {
                        throw error(peek(), "Missing 'end module' for module '" + name.text() + "'.");
                    }
                    if (atEndOf("module")) {
                        break;
                    }
                    parseUnit(module);
                }
            }
            consumeEnd("module");
        } finally {
            scopes.pop();
        }
        file.addChild(module);
    }

    private void parseRoutine(Container parent, boolean program) {
        advance();
        Token name = consume(TokenType.IDENTIFIER, "Expected a name after '" + previous().text() + "'.");
        List<String> argumentNames = new ArrayList<>();
        if (match(TokenType.LEFT_PAREN)) {
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    if (check(TokenType.STAR)) {
                        throw new UnsupportedSyntax("alternate return argument");
                    }
                    argumentNames.add(consume(TokenType.IDENTIFIER, "Expected an argument name.").text());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "Expected ')' after the argument list.");
        }
        endOfStatement();

        SymbolTable table = new SymbolTable();
        List<Node> body;
        List<DataSymbol> arguments = new ArrayList<>();
        scopes.push(table);
        try {
            parseSpecification(argumentNames);
            for (String argumentName : argumentNames) {
                Symbol symbol = table.lookupLocal(argumentName).orElse(null);
                if (symbol == null) {
                    symbol = new DataSymbol(argumentName, DeferredType.INSTANCE,
                            new ArgumentInterface(ArgumentInterface.Access.UNKNOWN));
                    table.add(symbol);
                }
                if (!(symbol instanceof DataSymbol argument) || !argument.isArgument()) {
                    throw new UnsupportedSyntax("argument '" + argumentName + "' is not a data argument");
                }
                arguments.add(argument);
            }
            String end = program ? "program" : "subroutine";
            body = parseBlock(() -> atEndOf(end) || checkKeyword("contains"));
            if (checkKeyword("contains")) {
                body.add(internalProcedures());
            }
            consumeEnd(end);
        } finally {
            scopes.pop();
        }
        Routine routine = new Routine(name.text(), table, program);
        for (Node statement : body) {
            routine.addChild(statement);
        }
        table.setArgumentList(arguments);
        parent.addChild(routine);
    }

    private CodeBlock internalProcedures() {
        int start = current;
        int depth = 0;
        while (!isAtEnd()) {
            skipNewlines();
            if (depth == 0 && closesUnit()) {
                break;
            }
            if (opensUnit()) {
                depth++;
            } else if (closesUnit()) {
                depth--;
            }
            skipStatement();
        }
        return codeBlock(start, current, CodeBlock.Structure.STATEMENT);
    }

    private CodeBlock unitCodeBlock() {
        int start = current;
        if (!opensUnit()) {
            skipStatement();
            return codeBlock(start, current, CodeBlock.Structure.STATEMENT);
        }
        int depth = 0;
        do {
            skipNewlines();
            if (opensUnit()) {
                depth++;
            } else if (closesUnit()) {
                depth--;
            }
            skipStatement();
        } while (depth > 0 && !isAtEnd());
        return codeBlock(start, current, CodeBlock.Structure.STATEMENT);
    }

    private boolean opensUnit() {
        if (checkKeyword("end")) {
            return false;
        }
        int depth = 0;
        for (int i = current; i < tokens.size() && tokens.get(i).type() != TokenType.NEWLINE; i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.LEFT_PAREN) {
                depth++;
            } else if (token.type() == TokenType.RIGHT_PAREN) {
                depth--;
            } else if (depth == 0 && token.type() == TokenType.IDENTIFIER
                    && UNIT_KEYWORDS.contains(lower(token))) {
                Token next = tokens.get(i + 1);
                return !(lower(token).equals("module") && next.isKeyword("procedure"));
            }
        }
        return false;
    }

    private boolean closesUnit() {
        if (checkKeyword("end")) {
            Token next = tokens.get(current + 1);
            return next.type() == TokenType.NEWLINE
                    || (next.type() == TokenType.IDENTIFIER && UNIT_KEYWORDS.contains(lower(next)));
        }
        return check(TokenType.IDENTIFIER) && lower(peek()).startsWith("end")
                && UNIT_KEYWORDS.contains(lower(peek()).substring(3));
    }

    // ------------------------------------------------------------------ specification part

    private void parseSpecification(List<String> argumentNames) {
        while (true) {
            skipNewlines();
            if (isAtEnd()) {
                return;
            }
            int start = current;
            try {
                if (checkKeyword("use")) {
                    parseUse();
                } else if (checkKeyword("implicit")) {
                    skipStatement();
                } else if (checkKeyword("type") && !checkNext(TokenType.LEFT_PAREN)) {
                    parseTypeDefinition();
                } else if (isDeclaration()) {
                    parseDeclaration(argumentNames);
                } else if (checkKeyword("private") || checkKeyword("public")) {
                    skipStatement();
                } else if (checkKeyword("interface") || (checkKeyword("abstract") && checkNextKeyword("interface"))) {
                    warn(peek(), "Interface block dropped; interfaces are not supported.");
                    skipUntilEnd("interface");
                } else if (checkKeyword("save") || checkKeyword("external") || checkKeyword("intrinsic")
                        || checkKeyword("parameter") || checkKeyword("data") || checkKeyword("common")
                        || checkKeyword("equivalence") || checkKeyword("namelist")) {
                    warn(peek(), "Specification statement '" + peek().text() + "' dropped; it is not supported.");
                    skipStatement();
                } else {
                    return;
                }
            } catch (ParseError e) {
                current = start;
                skipStatement();
            } catch (UnsupportedSyntax | PsyirException | IllegalArgumentException e) {
                warn(tokens.get(start), "Declaration dropped: " + e.getMessage());
                current = start;
                skipStatement();
            }
        }
    }

    private boolean isDeclaration() {
        if (!check(TokenType.IDENTIFIER) || !TYPE_KEYWORDS.contains(lower(peek()))) {
            return false;
        }
        for (int i = current; i < tokens.size() && tokens.get(i).type() != TokenType.NEWLINE; i++) {
            if (tokens.get(i).isKeyword("function")) {
                return false;
            }
        }
        return true;
    }

    private void parseUse() {
        advance();
        boolean intrinsic = false;
        if (match(TokenType.COMMA)) {
            intrinsic = consume(TokenType.IDENTIFIER, "Expected 'intrinsic' or 'non_intrinsic'.").isKeyword("intrinsic");
        }
        match(TokenType.DOUBLE_COLON);
        Token module = consume(TokenType.IDENTIFIER, "Expected a module name after 'use'.");
        if (intrinsic) {
            skipStatement();
            return;
        }
        SymbolTable table = scope();
        ContainerSymbol container = table.lookupLocal(module.text())
                .filter(ContainerSymbol.class::isInstance)
                .map(ContainerSymbol.class::cast)
                .orElseGet(() -> {
                    ContainerSymbol created = new ContainerSymbol(module.text());
                    table.add(created);
                    return created;
                });
        if (match(TokenType.COMMA)) {
            if (matchKeyword("only")) {
                consume(TokenType.COLON, "Expected ':' after 'only'.");
                if (!check(TokenType.NEWLINE)) {
                    do {
                        importName(container);
                    } while (match(TokenType.COMMA));
                }
            } else {
                warn(module, "Renames in 'use " + module.text() + "' are ignored.");
                container.setWildcardImport(true);
                skipStatement();
                return;
            }
        } else {
            container.setWildcardImport(true);
        }
        endOfStatement();
    }

    private void importName(ContainerSymbol container) {
        Token name = consume(TokenType.IDENTIFIER, "Expected a name in the 'only' list.");
        if ((name.isKeyword("operator") || name.isKeyword("assignment")) && check(TokenType.LEFT_PAREN)) {
            warn(name, "Import of '" + name.text() + "(...)' from '" + container.getName() + "' is ignored.");
            skipGroup();
            return;
        }
        if (match(TokenType.ARROW)) {
            Token remote = consume(TokenType.IDENTIFIER, "Expected a name after '=>'.");
            warn(name, "Renamed import '" + name.text() + " => " + remote.text() + "' is imported as '" + name.text() + "'.");
        }
        if (scope().lookupLocal(name.text()).isEmpty()) {
            scope().add(new DataSymbol(name.text(), DeferredType.INSTANCE, new ImportInterface(container)));
        }
    }

    private void parseTypeDefinition() {
        int start = current;
        advance();
        while (match(TokenType.COMMA)) {
            consume(TokenType.IDENTIFIER, "Expected a type attribute.");
            if (check(TokenType.LEFT_PAREN)) {
                skipGroup();
            }
        }
        match(TokenType.DOUBLE_COLON);
        Token name = consume(TokenType.IDENTIFIER, "Expected the name of the derived type.");
        skipStatement();
        while (!isAtEnd() && !(checkKeyword("endtype") || (checkKeyword("end") && checkNextKeyword("type")))) {
            skipStatement();
        }
        if (isAtEnd()) {
            throw error(name, "Missing 'end type' for derived type '" + name.text() + "'.");
        }
        skipStatement();
        String definition = String.join("\n", codeBlock(start, current, CodeBlock.Structure.STATEMENT).getLines());
        scope().add(new TypeSymbol(name.text(), new UnsupportedType(definition)));
    }

    private void parseDeclaration(List<String> argumentNames) {
        int specStart = current;
        Token keyword = advance();
        ScalarType.Intrinsic intrinsic = null;
        PrecisionSpec precision = ScalarType.Precision.UNDEFINED;
        boolean representable = true;
        switch (lower(keyword)) {
            case "integer" -> intrinsic = ScalarType.Intrinsic.INTEGER;
            case "real" -> intrinsic = ScalarType.Intrinsic.REAL;
            case "logical" -> intrinsic = ScalarType.Intrinsic.BOOLEAN;
            case "character" -> intrinsic = ScalarType.Intrinsic.CHARACTER;
            case "double" -> {
                if (!matchKeyword("precision")) {
                    throw error(peek(), "Expected 'precision' after 'double'.");
                }
                intrinsic = ScalarType.Intrinsic.REAL;
                precision = ScalarType.Precision.DOUBLE;
            }
            default -> representable = false;
        }
        if (intrinsic == ScalarType.Intrinsic.CHARACTER || !representable) {
            if (check(TokenType.LEFT_PAREN)) {
                skipGroup();
                representable = false;
            } else if (match(TokenType.STAR)) {
                advance();
                representable = false;
            }
        } else if (precision == ScalarType.Precision.UNDEFINED) {
            precision = parseKind();
            representable = precision != null;
        }

        String intent = null;
        List<Dimension> attributeShape = null;
        boolean parameter = false;
        boolean allocatable = false;
        while (match(TokenType.COMMA)) {
            Token attribute = consume(TokenType.IDENTIFIER, "Expected a declaration attribute.");
            switch (lower(attribute)) {
                case "intent" -> {
                    consume(TokenType.LEFT_PAREN, "Expected '(' after 'intent'.");
                    StringBuilder words = new StringBuilder();
                    while (check(TokenType.IDENTIFIER)) {
                        words.append(lower(advance()));
                    }
                    consume(TokenType.RIGHT_PAREN, "Expected ')' after the intent.");
                    intent = words.toString();
                }
                case "dimension" -> attributeShape = parseDimensions();
                case "parameter" -> parameter = true;
                case "allocatable" -> allocatable = true;
                default -> {
                    representable = false;
                    if (check(TokenType.LEFT_PAREN)) {
                        skipGroup();
                    }
                }
            }
        }
        String specText = text(specStart, current);
        match(TokenType.DOUBLE_COLON);

        do {
            Token name = consume(TokenType.IDENTIFIER, "Expected a variable name in the declaration.");
            List<Dimension> entityShape = check(TokenType.LEFT_PAREN) ? parseDimensions() : null;
            boolean entityRepresentable = representable;
            if (match(TokenType.STAR)) {
                if (check(TokenType.LEFT_PAREN)) {
                    skipGroup();
                } else {
                    advance();
                }
                entityRepresentable = false;
            }
            Node initialValue = null;
            if (match(TokenType.EQUALS)) {
                initialValue = expression();
            } else if (match(TokenType.ARROW)) {
                initialValue = expression();
                entityRepresentable = false;
            }

            boolean argument = argumentNames.stream().anyMatch(n -> n.equalsIgnoreCase(name.text()));
            List<Dimension> shape = entityShape != null ? entityShape : attributeShape;
            DataType type = null;
            if (entityRepresentable) {
                ScalarType scalar = new ScalarType(intrinsic, precision);
                if (shape == null) {
                    type = scalar;
                } else {
                    List<ArrayDimension> extents = toShape(shape, allocatable, argument);
                    type = extents == null ? null : new ArrayType(scalar, extents);
                }
            }
            if (type == null) {
                String declaration = specText;
                if (entityShape != null) {
                    declaration += ", dimension(" + String.join(", ", entityShape.stream().map(Dimension::text).toList()) + ")";
                }
                type = new UnsupportedType(declaration);
            }
            SymbolInterface symbolInterface = argument
                    ? new ArgumentInterface(intent == null ? ArgumentInterface.Access.UNKNOWN
                            : ArgumentInterface.Access.fromIntent(intent))
                    : new LocalInterface();
            declare(name, type, symbolInterface, initialValue, parameter);
        } while (match(TokenType.COMMA));
        endOfStatement();
    }

    private void declare(Token name, DataType type, SymbolInterface symbolInterface, Node initialValue, boolean parameter) {
        SymbolTable table = scope();
        Optional<Symbol> existing = table.lookupLocal(name.text());
        DataSymbol symbol;
        if (existing.isPresent()) {
            // a kind or extent used before its declaration was recorded as unresolved
            if (!(existing.get() instanceof DataSymbol data) || !data.isUnresolved()) {
                throw error(name, "Symbol '" + name.text() + "' is declared more than once.");
            }
            symbol = data;
            symbol.setDatatype(type);
            symbol.setInterface(symbolInterface);
        } else {
            symbol = new DataSymbol(name.text(), type, symbolInterface);
            table.add(symbol);
        }
        if (parameter && initialValue == null) {
            throw error(name, "Named constant '" + name.text() + "' requires a value.");
        }
        if (initialValue != null) {
            symbol.setInitialValue(initialValue, parameter);
        }
    }

    private PrecisionSpec parseKind() {
        if (match(TokenType.STAR)) {
            Token bytes = consume(TokenType.INTEGER, "Expected a byte count after '*'.");
            return new BytePrecision(Integer.parseInt(bytes.text()));
        }
        if (!check(TokenType.LEFT_PAREN)) {
            return ScalarType.Precision.UNDEFINED;
        }
        int open = current;
        advance();
        if (checkKeyword("kind") && checkNext(TokenType.EQUALS)) {
            advance();
            advance();
        }
        if (check(TokenType.INTEGER) && checkNext(TokenType.RIGHT_PAREN)) {
            int bytes = Integer.parseInt(advance().text());
            advance();
            return new BytePrecision(bytes);
        }
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.RIGHT_PAREN)) {
            DataSymbol kind = kindSymbol(advance().text());
            advance();
            return kind == null ? null : new SymbolPrecision(kind);
        }
        current = open;
        skipGroup();
        return null;
    }

    private DataSymbol kindSymbol(String name) {
        Optional<Symbol> found = resolve(name);
        if (found.isEmpty()) {
            return declareUnresolved(name);
        }
        if (found.get() instanceof DataSymbol data && (data.getDatatype() instanceof DeferredType
                || (data.getDatatype() instanceof ScalarType scalar && scalar.getIntrinsic() == ScalarType.Intrinsic.INTEGER))) {
            return data;
        }
        return null;
    }

    private List<Dimension> parseDimensions() {
        consume(TokenType.LEFT_PAREN, "Expected '(' before the dimensions.");
        List<Dimension> dimensions = new ArrayList<>();
        do {
            int start = current;
            int depth = 0;
            while (!isAtEnd() && !check(TokenType.NEWLINE)
                    && !(depth == 0 && (check(TokenType.COMMA) || check(TokenType.RIGHT_PAREN)))) {
                if (check(TokenType.LEFT_PAREN)) {
                    depth++;
                } else if (check(TokenType.RIGHT_PAREN)) {
                    depth--;
                }
                advance();
            }
            String text = text(start, current);
            Dimension.Kind kind = Dimension.Kind.OTHER;
            if (current - start == 1) {
                Token token = tokens.get(start);
                if (token.type() == TokenType.COLON) {
                    kind = Dimension.Kind.COLON;
                } else if (token.type() == TokenType.INTEGER && !token.text().contains("_")) {
                    kind = Dimension.Kind.LITERAL;
                } else if (token.type() == TokenType.IDENTIFIER) {
                    kind = Dimension.Kind.NAME;
                }
            }
            dimensions.add(new Dimension(kind, text));
        } while (match(TokenType.COMMA));
        consume(TokenType.RIGHT_PAREN, "Expected ')' after the dimensions.");
        return dimensions;
    }

    private List<ArrayDimension> toShape(List<Dimension> dimensions, boolean allocatable, boolean argument) {
        List<ArrayDimension> shape = new ArrayList<>();
        for (Dimension dimension : dimensions) {
            switch (dimension.kind()) {
                case COLON -> shape.add(allocatable || !argument ? ArrayType.Extent.DEFERRED : ArrayType.Extent.ATTRIBUTE);
                case LITERAL -> {
                    int extent = Integer.parseInt(dimension.text());
                    if (extent <= 0) {
                        return null;
                    }
                    shape.add(new LiteralExtent(extent));
                }
                case NAME -> {
                    Optional<Symbol> symbol = resolve(dimension.text());
                    if (symbol.isEmpty() || !(symbol.get() instanceof DataSymbol data)
                            || !(data.getDatatype() instanceof DeferredType
                            || (data.getDatatype() instanceof ScalarType scalar
                            && scalar.getIntrinsic() == ScalarType.Intrinsic.INTEGER))) {
                        return null;
                    }
                    shape.add(new SymbolExtent(data));
                }
                default -> {
                    return null;
                }
            }
        }
        return shape;
    }

    // ------------------------------------------------------------------ executable part

    private List<Node> parseBlock(BooleanSupplier terminator) {
        List<Node> statements = new ArrayList<>();
        while (true) {
            skipNewlines();
            if (isAtEnd()) {
                throw error(peek(), "Unexpected end of file inside a block.");
            }
            if (terminator.getAsBoolean()) {
                return statements;
            }
            statements.add(parseStatement());
        }
    }

    private Node parseStatement() {
        int start = current;
        try {
            if (checkKeyword("do") && checkNext(TokenType.IDENTIFIER) && checkAt(2, TokenType.EQUALS)) {
                return parseDo();
            }
            if (checkKeyword("if") && checkNext(TokenType.LEFT_PAREN)) {
                return parseIf();
            }
            return parseSimpleStatement();
        } catch (ParseError | UnsupportedSyntax | PsyirException e) {
            CompilerLogger.debug("Statement at line {} kept as a code block: {}", tokens.get(start).line(), e.getMessage());
            current = start;
            return constructCodeBlock();
        }
    }

    private Node parseSimpleStatement() {
        if (checkKeyword("call") && checkNext(TokenType.IDENTIFIER)) {
            return parseCall();
        }
        if (checkKeyword("return") && checkNext(TokenType.NEWLINE)) {
            advance();
            advance();
            return new Return();
        }
        if (check(TokenType.IDENTIFIER) && isAssignment()) {
            return parseAssignment();
        }
        throw new UnsupportedSyntax("statement starting with '" + peek().text() + "'");
    }

    private Loop parseDo() {
        advance();
        Token variable = advance();
        consume(TokenType.EQUALS, "Expected '=' after the loop variable.");
        Node start = expression();
        consume(TokenType.COMMA, "Expected ',' after the loop start.");
        Node stop = expression();
        Node step = match(TokenType.COMMA) ? expression() : Literal.ofInteger(1);
        endOfStatement();
        if (!(symbolFor(variable.text()) instanceof DataSymbol loopVariable)) {
            throw new UnsupportedSyntax("loop variable '" + variable.text() + "' is not a variable");
        }
        List<Node> body = parseBlock(() -> atEndOf("do"));
        consumeEnd("do");
        return Loop.create(loopVariable, start, stop, step, body);
    }

    private IfBlock parseIf() {
        advance();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'.");
        Node condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after the condition.");
        if (matchKeyword("then")) {
            endOfStatement();
            return parseIfRest(condition);
        }
        return IfBlock.create(condition, List.of(parseSimpleStatement()), null);
    }

    private IfBlock parseIfRest(Node condition) {
        List<Node> ifBody = parseBlock(() -> atEndOf("if") || checkKeyword("else") || checkKeyword("elseif"));
        if (checkKeyword("elseif") || (checkKeyword("else") && checkNextKeyword("if"))) {
            if (!matchKeyword("elseif")) {
                advance();
                advance();
            }
            consume(TokenType.LEFT_PAREN, "Expected '(' after 'else if'.");
            Node elseCondition = expression();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after the condition.");
            if (!matchKeyword("then")) {
                throw error(peek(), "Expected 'then' after the 'else if' condition.");
            }
            endOfStatement();
            return IfBlock.create(condition, ifBody, List.of(parseIfRest(elseCondition)));
        }
        if (matchKeyword("else")) {
            match(TokenType.IDENTIFIER);
            endOfStatement();
            List<Node> elseBody = parseBlock(() -> atEndOf("if"));
            consumeEnd("if");
            return IfBlock.create(condition, ifBody, elseBody);
        }
        consumeEnd("if");
        return IfBlock.create(condition, ifBody, null);
    }

    private Call parseCall() {
        advance();
        Token name = advance();
        if (check(TokenType.PERCENT)) {
            throw new UnsupportedSyntax("type-bound procedure call");
        }
        List<Node> arguments = new ArrayList<>();
        if (match(TokenType.LEFT_PAREN)) {
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUALS)) {
                        throw new UnsupportedSyntax("keyword argument in call to '" + name.text() + "'");
                    }
                    arguments.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "Expected ')' after the call arguments.");
        }
        endOfStatement();
        return Call.create(routineSymbol(name.text()), arguments);
    }

    private Assignment parseAssignment() {
        Node target = designator(true);
        if (!(target instanceof Reference)) {
            throw new UnsupportedSyntax("assignment to '" + target + "'");
        }
        consume(TokenType.EQUALS, "Expected '=' in the assignment.");
        Node value = expression();
        endOfStatement();
        return Assignment.create(target, value);
    }

    private boolean isAssignment() {
        int depth = 0;
        for (int i = current; i < tokens.size() && tokens.get(i).type() != TokenType.NEWLINE; i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.LEFT_PAREN) {
                depth++;
            } else if (type == TokenType.RIGHT_PAREN) {
                depth--;
            } else if (type == TokenType.EQUALS && depth == 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Keeps a statement, or a whole construct when the statement opens one, as a code block.
     */
    private CodeBlock constructCodeBlock() {
        int start = current;
        if (constructOpened() == null) {
            skipStatement();
            return codeBlock(start, current, CodeBlock.Structure.STATEMENT);
        }
        int depth = 0;
        do {
            skipNewlines();
            if (constructOpened() != null) {
                depth++;
            } else if (closesConstruct()) {
                depth--;
            }
            skipStatement();
        } while (depth > 0 && !isAtEnd());
        return codeBlock(start, current, CodeBlock.Structure.STATEMENT);
    }

    private String constructOpened() {
        int i = current;
        if (tokens.get(i).type() == TokenType.IDENTIFIER && tokens.get(i + 1).type() == TokenType.COLON) {
            i += 2;
        }
        Token first = tokens.get(i);
        if (first.type() != TokenType.IDENTIFIER) {
            return null;
        }
        String word = lower(first);
        Token next = tokens.get(i + 1);
        return switch (word) {
            case "do" -> next.type() == TokenType.INTEGER ? null : word;
            case "if" -> lastTokenOfStatement(i).isKeyword("then") ? word : null;
            case "select", "associate", "critical" -> word;
            case "block" -> next.type() == TokenType.NEWLINE ? word : null;
            case "where", "forall" -> next.type() == TokenType.LEFT_PAREN
                    && tokens.get(matchingParen(i + 1) + 1).type() == TokenType.NEWLINE ? word : null;
            default -> null;
        };
    }

    private boolean closesConstruct() {
        if (checkKeyword("end")) {
            Token next = tokens.get(current + 1);
            return next.type() == TokenType.IDENTIFIER && CONSTRUCT_KEYWORDS.contains(lower(next));
        }
        return check(TokenType.IDENTIFIER) && lower(peek()).startsWith("end")
                && CONSTRUCT_KEYWORDS.contains(lower(peek()).substring(3));
    }

    private Token lastTokenOfStatement(int from) {
        int i = from;
        while (tokens.get(i + 1).type() != TokenType.NEWLINE && tokens.get(i + 1).type() != TokenType.END_OF_FILE) {
            i++;
        }
        return tokens.get(i);
    }

    private int matchingParen(int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.LEFT_PAREN) {
                depth++;
            } else if (type == TokenType.RIGHT_PAREN && --depth == 0) {
                return i;
            } else if (type == TokenType.NEWLINE) {
                return i - 1;
            }
        }
        return tokens.size() - 2;
    }

    // ------------------------------------------------------------------ expressions

    private Node expression() {
        return or();
    }

    private Node or() {
        Node left = and();
        while (matchDot("or")) {
            left = BinaryOperation.create(BinaryOperation.Operator.OR, left, and());
        }
        return left;
    }

    private Node and() {
        Node left = not();
        while (matchDot("and")) {
            left = BinaryOperation.create(BinaryOperation.Operator.AND, left, not());
        }
        return left;
    }

    private Node not() {
        if (matchDot("not")) {
            return UnaryOperation.create(UnaryOperation.Operator.NOT, not());
        }
        return comparison();
    }

    private Node comparison() {
        Node left = additive();
        BinaryOperation.Operator operator = relational();
        if (operator != null) {
            return BinaryOperation.create(operator, left, additive());
        }
        if (check(TokenType.DOT_OPERATOR) && ("eqv".equals(peek().value()) || "neqv".equals(peek().value()))) {
            throw new UnsupportedSyntax("operator '" + peek().text() + "'");
        }
        if (check(TokenType.CONCAT)) {
            throw new UnsupportedSyntax("character concatenation");
        }
        return left;
    }

    private BinaryOperation.Operator relational() {
        BinaryOperation.Operator operator = switch (peek().type()) {
            case EQUAL_EQUAL -> BinaryOperation.Operator.EQ;
            case NOT_EQUAL -> BinaryOperation.Operator.NE;
            case LESS -> BinaryOperation.Operator.LT;
            case LESS_EQUAL -> BinaryOperation.Operator.LE;
            case GREATER -> BinaryOperation.Operator.GT;
            case GREATER_EQUAL -> BinaryOperation.Operator.GE;
            case DOT_OPERATOR -> switch ((String) peek().value()) {
                case "eq" -> BinaryOperation.Operator.EQ;
                case "ne" -> BinaryOperation.Operator.NE;
                case "lt" -> BinaryOperation.Operator.LT;
                case "le" -> BinaryOperation.Operator.LE;
                case "gt" -> BinaryOperation.Operator.GT;
                case "ge" -> BinaryOperation.Operator.GE;
                default -> null;
            };
            default -> null;
        };
        if (operator != null) {
            advance();
        }
        return operator;
    }

    private Node additive() {
        Node left;
        if (match(TokenType.MINUS)) {
            left = UnaryOperation.create(UnaryOperation.Operator.MINUS, multiplicative());
        } else if (match(TokenType.PLUS)) {
            left = UnaryOperation.create(UnaryOperation.Operator.PLUS, multiplicative());
        } else {
            left = multiplicative();
        }
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            BinaryOperation.Operator operator = advance().type() == TokenType.PLUS
                    ? BinaryOperation.Operator.ADD : BinaryOperation.Operator.SUB;
            left = BinaryOperation.create(operator, left, multiplicative());
        }
        return left;
    }

    private Node multiplicative() {
        Node left = power();
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            BinaryOperation.Operator operator = advance().type() == TokenType.STAR
                    ? BinaryOperation.Operator.MUL : BinaryOperation.Operator.DIV;
            left = BinaryOperation.create(operator, left, power());
        }
        return left;
    }

    private Node power() {
        Node base = primary();
        if (match(TokenType.POWER)) {
            return BinaryOperation.create(BinaryOperation.Operator.POW, base, power());
        }
        return base;
    }

    private Node primary() {
        if (match(TokenType.INTEGER)) {
            return literal(previous(), ScalarType.Intrinsic.INTEGER);
        }
        if (match(TokenType.REAL)) {
            return literal(previous(), ScalarType.Intrinsic.REAL);
        }
        if (match(TokenType.STRING)) {
            return new Literal((String) previous().value(), ScalarType.CHARACTER_TYPE);
        }
        if (check(TokenType.DOT_OPERATOR) && ("true".equals(peek().value()) || "false".equals(peek().value()))) {
            return new Literal((String) advance().value(), ScalarType.BOOLEAN_TYPE);
        }
        if (match(TokenType.LEFT_PAREN)) {
            Node inner = expression();
            if (check(TokenType.COMMA)) {
                throw new UnsupportedSyntax("complex literal");
            }
            consume(TokenType.RIGHT_PAREN, "Expected ')' after the expression.");
            return inner;
        }
        // a signed operand after a binary operator, as in 'a * -1.0'
        if (match(TokenType.MINUS)) {
            return UnaryOperation.create(UnaryOperation.Operator.MINUS, power());
        }
        if (match(TokenType.PLUS)) {
            return UnaryOperation.create(UnaryOperation.Operator.PLUS, power());
        }
        if (check(TokenType.IDENTIFIER)) {
            return designator(false);
        }
        if (check(TokenType.SLASH) || check(TokenType.LEFT_PAREN)) {
            throw new UnsupportedSyntax("array constructor");
        }
        throw error(peek(), "Unexpected token '" + peek().text() + "' in expression.");
    }

    private Literal literal(Token token, ScalarType.Intrinsic intrinsic) {
        String text = token.text();
        int underscore = text.indexOf('_');
        if (underscore < 0) {
            return new Literal(text, intrinsic == ScalarType.Intrinsic.INTEGER ? ScalarType.INTEGER_TYPE : ScalarType.REAL_TYPE);
        }
        String value = text.substring(0, underscore);
        String kind = text.substring(underscore + 1);
        if (kind.chars().allMatch(Character::isDigit)) {
            return new Literal(value, new ScalarType(intrinsic, Integer.parseInt(kind)));
        }
        DataSymbol kindSymbol = kindSymbol(kind);
        if (kindSymbol == null) {
            throw new UnsupportedSyntax("kind '" + kind + "' of literal '" + text + "'");
        }
        return new Literal(value, new ScalarType(intrinsic, kindSymbol));
    }

    private Node designator(boolean target) {
        Token name = advance();
        if (check(TokenType.LEFT_PAREN)) {
            Optional<Symbol> found = resolve(name.text());
            Optional<IntrinsicCall.Intrinsic> intrinsic = IntrinsicCall.Intrinsic.fromName(name.text());
            if (found.isEmpty() && intrinsic.isPresent() && !target) {
                return intrinsicCall(intrinsic.get());
            }
            Symbol symbol = found.orElseGet(() -> declareUnresolved(name.text()));
            if (!(symbol instanceof DataSymbol)) {
                throw new UnsupportedSyntax("call of function '" + name.text() + "'");
            }
            advance();
            List<Node> indices = new ArrayList<>();
            int dimension = 0;
            do {
                indices.add(index(symbol, dimension++));
            } while (match(TokenType.COMMA));
            consume(TokenType.RIGHT_PAREN, "Expected ')' after the array indices.");
            if (check(TokenType.PERCENT) || check(TokenType.LEFT_PAREN)) {
                throw new UnsupportedSyntax("component or substring of '" + name.text() + "(...)'");
            }
            return ArrayReference.create(symbol, indices);
        }
        Symbol symbol = symbolFor(name.text());
        if (check(TokenType.PERCENT)) {
            List<String> members = new ArrayList<>();
            while (match(TokenType.PERCENT)) {
                members.add(consume(TokenType.IDENTIFIER, "Expected a component name after '%'.").text());
                if (check(TokenType.LEFT_PAREN)) {
                    throw new UnsupportedSyntax("array component of '" + name.text() + "'");
                }
            }
            return StructureReference.create(symbol, members.toArray(new String[0]));
        }
        if (symbol instanceof RoutineSymbol) {
            throw new UnsupportedSyntax("reference to routine '" + name.text() + "'");
        }
        return new Reference(symbol);
    }

    private IntrinsicCall intrinsicCall(IntrinsicCall.Intrinsic intrinsic) {
        advance();
        List<Node> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUALS)) {
                    throw new UnsupportedSyntax("keyword argument of " + intrinsic);
                }
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after the intrinsic arguments.");
        if (check(TokenType.PERCENT) || check(TokenType.LEFT_PAREN)) {
            throw new UnsupportedSyntax("selector after " + intrinsic);
        }
        return IntrinsicCall.create(intrinsic, arguments);
    }

    private Node index(Symbol array, int dimension) {
        Node start = null;
        if (!check(TokenType.COLON)) {
            start = expression();
            if (!check(TokenType.COLON)) {
                return start;
            }
        }
        consume(TokenType.COLON, "Expected ':' in the array range.");
        Node stop = null;
        if (!check(TokenType.COMMA) && !check(TokenType.RIGHT_PAREN) && !check(TokenType.COLON)) {
            stop = expression();
        }
        Node step = match(TokenType.COLON) ? expression() : Literal.ofInteger(1);
        return Range.create(
                start != null ? start : bound(IntrinsicCall.Intrinsic.LBOUND, array, dimension),
                stop != null ? stop : bound(IntrinsicCall.Intrinsic.UBOUND, array, dimension),
                step);
    }

    private static Node bound(IntrinsicCall.Intrinsic intrinsic, Symbol array, int dimension) {
        return IntrinsicCall.create(intrinsic, List.of(new Reference(array), Literal.ofInteger(dimension + 1)));
    }

    // ------------------------------------------------------------------ symbols

    private SymbolTable scope() {
        return scopes.peek();
    }

    private Optional<Symbol> resolve(String name) {
        for (SymbolTable table : scopes) {
            Optional<Symbol> symbol = table.lookupLocal(name);
            if (symbol.isPresent()) {
                return symbol;
            }
        }
        return scopes.peekLast().resolve(name);
    }

    private Symbol symbolFor(String name) {
        return resolve(name).orElseGet(() -> declareUnresolved(name));
    }

    private DataSymbol declareUnresolved(String name) {
        DataSymbol symbol = new DataSymbol(name, DeferredType.INSTANCE, new UnresolvedInterface());
        scope().add(symbol);
        return symbol;
    }

    /**
     * Finds or creates the symbol of a called routine. A name imported without a known kind is
     * turned into a routine symbol in the scope that imports it.
     */
    private RoutineSymbol routineSymbol(String name) {
        Optional<Symbol> found = resolve(name);
        if (found.isEmpty()) {
            RoutineSymbol routine = new RoutineSymbol(name, new UnresolvedInterface());
            scope().add(routine);
            return routine;
        }
        Symbol symbol = found.get();
        if (symbol instanceof RoutineSymbol routine) {
            return routine;
        }
        if (symbol instanceof DataSymbol data && data.getDatatype() instanceof DeferredType
                && (data.isImport() || data.isUnresolved())) {
            for (SymbolTable table : scopes) {
                if (table.lookupLocal(name).orElse(null) == symbol) {
                    table.remove(symbol);
                    RoutineSymbol routine = new RoutineSymbol(symbol.getName(), symbol.getInterface());
                    table.add(routine);
                    return routine;
                }
            }
        }
        throw new UnsupportedSyntax("call of '" + name + "' which is not a routine");
    }

    // ------------------------------------------------------------------ code blocks

    private CodeBlock codeBlock(int from, int to, CodeBlock.Structure structure) {
        int last = to - 1;
        while (last > from && (tokens.get(last).type() == TokenType.NEWLINE
                || tokens.get(last).type() == TokenType.END_OF_FILE)) {
            last--;
        }
        int firstLine = tokens.get(from).line();
        int lastLine = Math.max(firstLine, tokens.get(last).line());
        List<String> lines = new ArrayList<>();
        for (int line = firstLine; line <= lastLine && line <= sourceLines.size(); line++) {
            String text = sourceLines.get(line - 1).strip();
            if (!text.isEmpty()) {
                lines.add(text);
            }
        }
        if (lines.isEmpty()) {
            lines.add(text(from, to));
        }
        return new CodeBlock(lines, structure);
    }

    /**
     * Re-creates readable text from tokens: a space between words and after commas, nothing elsewhere.
     */
    private String text(int from, int to) {
        StringBuilder text = new StringBuilder();
        Token previous = null;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.NEWLINE || token.type() == TokenType.END_OF_FILE) {
                continue;
            }
            if (previous != null && (previous.type() == TokenType.COMMA
                    || (isWord(previous) && isWord(token)))) {
                text.append(' ');
            }
            text.append(token.text());
            previous = token;
        }
        return text.toString();
    }

    private static boolean isWord(Token token) {
        return token.type() == TokenType.IDENTIFIER || token.type() == TokenType.INTEGER || token.type() == TokenType.REAL;
    }

    // ------------------------------------------------------------------ token helpers

    private boolean atEndOf(String construct) {
        if (checkKeyword("end" + construct)) {
            return true;
        }
        if (!checkKeyword("end")) {
            return false;
        }
        Token next = tokens.get(current + 1);
        return next.isKeyword(construct) || (next.type() == TokenType.NEWLINE
                && (construct.equals("subroutine") || construct.equals("program") || construct.equals("module")));
    }

    private void consumeEnd(String construct) {
        if (!atEndOf(construct)) {
            throw error(peek(), "Expected 'end " + construct + "' but found '" + peek().text() + "'.");
        }
        if (matchKeyword("end")) {
            matchKeyword(construct);
        } else {
            advance();
        }
        match(TokenType.IDENTIFIER);
        endOfStatement();
    }

    private void skipUntilEnd(String construct) {
        while (!isAtEnd() && !atEndOf(construct)) {
            skipStatement();
            skipNewlines();
        }
        skipStatement();
    }

    private void skipGroup() {
        consume(TokenType.LEFT_PAREN, "Expected '('.");
        int depth = 1;
        while (depth > 0 && !isAtEnd() && !check(TokenType.NEWLINE)) {
            Token token = advance();
            if (token.type() == TokenType.LEFT_PAREN) {
                depth++;
            } else if (token.type() == TokenType.RIGHT_PAREN) {
                depth--;
            }
        }
        if (depth > 0) {
            throw error(peek(), "Unbalanced parentheses.");
        }
    }

    private void skipStatement() {
        while (!isAtEnd() && !check(TokenType.NEWLINE)) {
            advance();
        }
        match(TokenType.NEWLINE);
    }

    private void skipNewlines() {
        while (match(TokenType.NEWLINE)) {
            // blank statements
        }
    }

    private void endOfStatement() {
        consume(TokenType.NEWLINE, "Expected the end of the statement but found '" + peek().text() + "'.");
    }

    private boolean matchDot(String word) {
        if (check(TokenType.DOT_OPERATOR) && word.equals(peek().value())) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (checkKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean checkKeyword(String keyword) {
        return peek().isKeyword(keyword);
    }

    private boolean checkNextKeyword(String keyword) {
        return current + 1 < tokens.size() && tokens.get(current + 1).isKeyword(keyword);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        return checkAt(1, type);
    }

    private boolean checkAt(int offset, TokenType type) {
        if (current + offset >= tokens.size()) return false;
        return tokens.get(current + offset).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private ParseError error(Token token, String message) {
        diagnostics.reportError(message, fileName, token.line(), token.column());
        return new ParseError(message);
    }

    private void warn(Token token, String message) {
        diagnostics.reportWarning(message, fileName, token.line(), token.column());
    }

    private static String lower(Token token) {
        return token.text().toLowerCase(Locale.ROOT);
    }
}
