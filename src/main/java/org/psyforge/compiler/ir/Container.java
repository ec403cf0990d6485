package org.psyforge.compiler.ir;

import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.symbols.SymbolTable;

import java.util.List;
import java.util.Optional;

/**
 * A module, or the file-level container that holds the program units of one source file.
 */
public class Container extends Node implements ScopingNode {

    private final String name;
    private final SymbolTable symbolTable;

    public Container(String name) {
        this(name, new SymbolTable());
    }

    public Container(String name, SymbolTable symbolTable) {
        if (name == null || name.isBlank()) {
            throw new GenerationException("A Container requires a name.");
        }
        this.name = name;
        this.symbolTable = symbolTable;
        symbolTable.attach(this);
    }

    public static Container create(String name, SymbolTable symbolTable, List<? extends Node> children) {
        Container container = new Container(name, symbolTable);
        container.initChildren(children);
        return container;
    }

    public String getName() {
        return name;
    }

    @Override
    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    /**
     * @param routineName A routine name, case-insensitive.
     * @return The routine of that name directly inside this container.
     */
    public Optional<Routine> findRoutine(String routineName) {
        return getChildren().stream()
                .filter(Routine.class::isInstance)
                .map(Routine.class::cast)
                .filter(r -> r.getName().equalsIgnoreCase(routineName))
                .findFirst();
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
        return child instanceof Container || child instanceof Routine || child instanceof CodeBlock;
    }

    @Override
    protected String childrenFormat() {
        return "[Container | Routine | CodeBlock]*";
    }

    @Override
    protected Node shallowCopy() {
        return new Container(name, symbolTable.shallowCopy());
    }

    @Override
    protected boolean hasSameData(Node other) {
        return name.equalsIgnoreCase(((Container) other).name);
    }

    @Override
    protected String describe() {
        return "name:'" + name + "'";
    }
}
