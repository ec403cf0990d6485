package org.psyforge.compiler.ir;

import org.psyforge.compiler.symbols.Symbol;
import org.psyforge.compiler.symbols.SymbolTable;

/**
 * A node that owns a {@link SymbolTable}.
 */
public interface ScopingNode {

    SymbolTable getSymbolTable();

    Node getParent();

    boolean referencesSymbol(Symbol symbol);
}
