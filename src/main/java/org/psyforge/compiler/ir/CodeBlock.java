package org.psyforge.compiler.ir;

import org.psyforge.compiler.analysis.AccessType;
import org.psyforge.compiler.analysis.VariablesAccessInfo;
import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.symbols.Symbol;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Source the reader does not model, kept verbatim so it can be written back unchanged.
 */
public class CodeBlock extends Node {

    private static final Pattern NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    /**
     * Whether the block stands in for statements or for an expression.
     */
    public enum Structure {
        STATEMENT,
        EXPRESSION
    }

    private final List<String> lines;
    private final Structure structure;

    public CodeBlock(List<String> lines, Structure structure) {
        if (lines == null || lines.isEmpty()) {
            throw new GenerationException("A CodeBlock requires at least one line of source.");
        }
        if (structure == null) {
            throw new GenerationException("A CodeBlock requires a structure.");
        }
        this.lines = List.copyOf(lines);
        this.structure = structure;
    }

    public List<String> getLines() {
        return lines;
    }

    public Structure getStructure() {
        return structure;
    }

    /**
     * Every name in the text that resolves to a symbol of the enclosing scopes may be read and written.
     */
    @Override
    public void referenceAccesses(VariablesAccessInfo info) {
        Optional<ScopingNode> scope = ancestor(ScopingNode.class);
        if (scope.isEmpty()) {
            return;
        }
        Set<String> names = new LinkedHashSet<>();
        for (String line : lines) {
            String code = line.contains("!") ? line.substring(0, line.indexOf('!')) : line;
            Matcher matcher = NAME.matcher(code);
            while (matcher.find()) {
                names.add(matcher.group());
            }
        }
        for (String name : names) {
            Optional<Symbol> symbol = scope.get().getSymbolTable().resolve(name);
            symbol.ifPresent(s -> info.addAccess(s, AccessType.READWRITE, this));
        }
    }

    @Override
    protected Node shallowCopy() {
        return new CodeBlock(lines, structure);
    }

    @Override
    protected boolean hasSameData(Node other) {
        CodeBlock block = (CodeBlock) other;
        return structure == block.structure && lines.equals(block.lines);
    }

    @Override
    protected String describe() {
        return structure + ", " + lines.size() + " line(s)";
    }
}
