package org.psyforge.compiler.frontend;

import org.psyforge.compiler.diagnostics.CompilerLogger;
import org.psyforge.compiler.diagnostics.DiagnosticsEngine;
import org.psyforge.compiler.frontend.lexer.FortranLexer;
import org.psyforge.compiler.frontend.lexer.Token;
import org.psyforge.compiler.ir.Container;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.symbols.SymbolTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Reads Fortran source into the IR.
 * <p>
 * Syntax errors are reported to the {@link DiagnosticsEngine} and the offending statement is kept
 * as a code block; callers check {@link DiagnosticsEngine#hasErrors()} to decide whether to continue.
 */
public class FortranReader {

    private static final String IN_MEMORY = "<memory>";

    private final DiagnosticsEngine diagnostics;
    private final String fileName;

    /**
     * Creates a reader for in-memory source.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public FortranReader(DiagnosticsEngine diagnostics) {
        this(diagnostics, IN_MEMORY);
    }

    /**
     * @param diagnostics The engine for reporting errors and warnings.
     * @param fileName The logical file name used in diagnostics and for naming the file container.
     */
    public FortranReader(DiagnosticsEngine diagnostics, String fileName) {
        this.diagnostics = diagnostics;
        this.fileName = fileName;
    }

    /**
     * Reads a whole source file.
     *
     * @param path The file to read.
     * @param diagnostics The engine for reporting errors and warnings.
     * @return The file container.
     * @throws IOException if the file cannot be read.
     */
    public static Container psyirFromFile(Path path, DiagnosticsEngine diagnostics) throws IOException {
        return new FortranReader(diagnostics, path.toString()).psyirFromSource(Files.readString(path));
    }

    /**
     * Parses a complete source text.
     * @param source The Fortran source.
     * @return A container for the file holding its modules and program units.
     */
    public Container psyirFromSource(String source) {
        List<Token> tokens = new FortranLexer(source, diagnostics, fileName).scanTokens();
        Container file = new FortranParser(tokens, source, diagnostics, fileName).parseFile(containerName());
        CompilerLogger.debug("Read {} program unit(s) from {}", file.getChildCount(), fileName);
        return file;
    }

    /**
     * Parses a single expression, resolving names against the given scope.
     *
     * @param expression The expression text.
     * @param scope The symbol table names are resolved in; unknown names are added to it as unresolved.
     * @return The expression, or an expression code block if it uses syntax the IR does not model.
     * @throws org.psyforge.compiler.api.GenerationException if the text is not a valid expression.
     */
    public Node psyirFromExpression(String expression, SymbolTable scope) {
        List<Token> tokens = new FortranLexer(expression, diagnostics, fileName).scanTokens();
        return new FortranParser(tokens, expression, diagnostics, fileName).parseStandaloneExpression(scope);
    }

    private String containerName() {
        String name = Path.of(fileName.equals(IN_MEMORY) ? "file" : fileName).getFileName().toString();
        int dot = name.indexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        if (name.isEmpty() || !Character.isLetter(name.charAt(0))) {
            return "file";
        }
        return name.toLowerCase(Locale.ROOT);
    }
}
