package org.psyforge.compiler.symbols;

/**
 * A module the current scope imports from. It holds no table of its own; the imported
 * symbols live in the importing table and point back here through an {@link ImportInterface}.
 */
public class ContainerSymbol extends Symbol {

    private boolean wildcardImport;

    public ContainerSymbol(String name) {
        super(name);
    }

    /**
     * @return true if the scope contains a {@code use} statement without an {@code only} list.
     */
    public boolean hasWildcardImport() {
        return wildcardImport;
    }

    public void setWildcardImport(boolean wildcardImport) {
        this.wildcardImport = wildcardImport;
    }

    @Override
    public String toString() {
        return getName() + ": ContainerSymbol<" + (wildcardImport ? "wildcard" : "only") + ">";
    }
}
