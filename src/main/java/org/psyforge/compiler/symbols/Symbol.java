package org.psyforge.compiler.symbols;

/**
 * A named entity of the IR. Symbols are compared by identity: two references denote the same
 * storage only if they point to the same symbol object.
 */
public class Symbol {

    /**
     * Visibility of a symbol declared in a module.
     */
    public enum Visibility {
        PUBLIC,
        PRIVATE
    }

    private String name;
    private Visibility visibility;
    private SymbolInterface symbolInterface;

    /**
     * Creates a public, local symbol.
     * @param name The name of the symbol.
     */
    public Symbol(String name) {
        this(name, Visibility.PUBLIC, new LocalInterface());
    }

    /**
     * Creates a symbol.
     *
     * @param name The name of the symbol.
     * @param visibility The visibility.
     * @param symbolInterface How the storage of the symbol is provided.
     */
    public Symbol(String name, Visibility visibility, SymbolInterface symbolInterface) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("A symbol requires a non-empty name.");
        }
        if (visibility == null) {
            throw new IllegalArgumentException("Symbol '" + name + "' requires a visibility.");
        }
        if (symbolInterface == null) {
            throw new IllegalArgumentException("Symbol '" + name + "' requires an interface.");
        }
        this.name = name;
        this.visibility = visibility;
        this.symbolInterface = symbolInterface;
    }

    public String getName() {
        return name;
    }

    /**
     * Only the owning {@link SymbolTable} may rename a symbol, so that its keys stay consistent.
     */
    void setName(String name) {
        this.name = name;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public void setVisibility(Visibility visibility) {
        if (visibility == null) {
            throw new IllegalArgumentException("Symbol '" + name + "' requires a visibility.");
        }
        this.visibility = visibility;
    }

    public SymbolInterface getInterface() {
        return symbolInterface;
    }

    public void setInterface(SymbolInterface symbolInterface) {
        if (symbolInterface == null) {
            throw new IllegalArgumentException("Symbol '" + name + "' requires an interface.");
        }
        this.symbolInterface = symbolInterface;
    }

    public boolean isLocal() {
        return symbolInterface instanceof LocalInterface;
    }

    public boolean isImport() {
        return symbolInterface instanceof ImportInterface;
    }

    public boolean isArgument() {
        return symbolInterface instanceof ArgumentInterface;
    }

    public boolean isUnresolved() {
        return symbolInterface instanceof UnresolvedInterface;
    }

    @Override
    public String toString() {
        return name + ": " + getClass().getSimpleName() + "<" + symbolInterface + ">";
    }
}
