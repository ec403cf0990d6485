package org.psyforge.compiler.symbols;

/**
 * A subroutine or function.
 */
public class RoutineSymbol extends Symbol {

    public RoutineSymbol(String name) {
        super(name);
    }

    public RoutineSymbol(String name, SymbolInterface symbolInterface) {
        super(name, Visibility.PUBLIC, symbolInterface);
    }
}
