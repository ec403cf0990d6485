package org.psyforge.compiler.symbols;

/**
 * The symbol is imported from a module.
 *
 * @param container The module the symbol is imported from.
 */
public record ImportInterface(ContainerSymbol container) implements SymbolInterface {

    public ImportInterface {
        if (container == null) {
            throw new IllegalArgumentException("An ImportInterface requires a ContainerSymbol.");
        }
    }

    @Override
    public String toString() {
        return "Import(container='" + container.getName() + "')";
    }
}
