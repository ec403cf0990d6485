package org.psyforge.compiler.ir;

import org.psyforge.compiler.analysis.AccessType;
import org.psyforge.compiler.analysis.VariablesAccessInfo;
import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.symbols.Symbol;

/**
 * A use of a symbol.
 */
public class Reference extends DataNode {

    private Symbol symbol;

    public Reference(Symbol symbol) {
        if (symbol == null) {
            throw new GenerationException("A Reference requires a symbol.");
        }
        this.symbol = symbol;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    /**
     * Rebinds the reference, e.g. after a symbol has been replaced in the table.
     * @param symbol The new symbol.
     */
    public void setSymbol(Symbol symbol) {
        if (symbol == null) {
            throw new GenerationException("A Reference requires a symbol.");
        }
        this.symbol = symbol;
    }

    public String getName() {
        return symbol.getName();
    }

    @Override
    public void referenceAccesses(VariablesAccessInfo info) {
        referenceAccesses(info, AccessType.READ);
    }

    /**
     * Records this reference with the given access type, then the accesses of its children.
     * @param info The accumulator.
     * @param accessType How the referenced storage is used here.
     */
    public void referenceAccesses(VariablesAccessInfo info, AccessType accessType) {
        info.addAccess(symbol, accessType, this);
    }

    @Override
    protected Node shallowCopy() {
        return new Reference(symbol);
    }

    @Override
    protected boolean hasSameData(Node other) {
        return symbol == ((Reference) other).symbol;
    }

    @Override
    protected String describe() {
        return "name:'" + symbol.getName() + "'";
    }
}
