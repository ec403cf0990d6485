package org.psyforge.compiler.ir;

import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.symbols.SymbolTable;

import java.util.List;

/**
 * A subroutine or main program: a named schedule with its own scope.
 */
public class Routine extends Schedule implements ScopingNode {

    private String name;
    private final boolean program;
    private final SymbolTable symbolTable;

    /**
     * Creates an empty subroutine with a fresh symbol table.
     * @param name The routine name.
     */
    public Routine(String name) {
        this(name, new SymbolTable(), false);
    }

    /**
     * @param name The routine name.
     * @param symbolTable A table not yet bound to another node.
     * @param program true for a main program.
     */
    public Routine(String name, SymbolTable symbolTable, boolean program) {
        if (name == null || name.isBlank()) {
            throw new GenerationException("A Routine requires a name.");
        }
        this.name = name;
        this.program = program;
        this.symbolTable = symbolTable;
        symbolTable.attach(this);
    }

    /**
     * @param name The routine name.
     * @param symbolTable A table not yet bound to another node.
     * @param statements Orphan statements of the body.
     * @return The new routine.
     */
    public static Routine create(String name, SymbolTable symbolTable, List<? extends Node> statements) {
        Routine routine = new Routine(name, symbolTable, false);
        routine.initChildren(statements);
        return routine;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isProgram() {
        return program;
    }

    @Override
    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    /**
     * The copy gets its own table holding the same symbol objects.
     */
    @Override
    protected Node shallowCopy() {
        return new Routine(name, symbolTable.shallowCopy(), program);
    }

    @Override
    protected boolean hasSameData(Node other) {
        Routine routine = (Routine) other;
        return name.equalsIgnoreCase(routine.name) && program == routine.program;
    }

    @Override
    protected String describe() {
        return "name:'" + name + "'";
    }
}
