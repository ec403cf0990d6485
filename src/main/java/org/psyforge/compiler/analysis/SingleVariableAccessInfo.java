package org.psyforge.compiler.analysis;

import org.psyforge.compiler.api.InternalCompilerException;
import org.psyforge.compiler.symbols.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All accesses to one symbol, in program order.
 */
public class SingleVariableAccessInfo {

    private final Symbol symbol;
    private final List<AccessInfo> accesses = new ArrayList<>();

    public SingleVariableAccessInfo(Symbol symbol) {
        this.symbol = symbol;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    void add(AccessInfo access) {
        accesses.add(access);
    }

    public List<AccessInfo> getAccesses() {
        return Collections.unmodifiableList(accesses);
    }

    /**
     * @return The access recorded last.
     * @throws InternalCompilerException if there is none.
     */
    public AccessInfo lastAccess() {
        if (accesses.isEmpty()) {
            throw new InternalCompilerException("No access recorded for '" + symbol.getName() + "'.");
        }
        return accesses.get(accesses.size() - 1);
    }

    public boolean isWritten() {
        return accesses.stream().anyMatch(a -> a.getAccessType().isWrite());
    }

    public boolean isRead() {
        return accesses.stream().anyMatch(a -> a.getAccessType().isRead());
    }

    /**
     * @return true if the symbol is only read (inquiries are ignored).
     */
    public boolean isReadOnly() {
        return isRead() && !isWritten();
    }

    /**
     * @return true if the first access that touches data is a pure write.
     */
    public boolean isWrittenFirst() {
        return accesses.stream()
                .filter(a -> a.getAccessType() != AccessType.INQUIRY)
                .findFirst()
                .map(a -> a.getAccessType() == AccessType.WRITE)
                .orElse(false);
    }

    public List<AccessInfo> allWriteAccesses() {
        return accesses.stream().filter(a -> a.getAccessType().isWrite()).toList();
    }

    public List<AccessInfo> allReadAccesses() {
        return accesses.stream().filter(a -> a.getAccessType().isRead()).toList();
    }

    @Override
    public String toString() {
        return symbol.getName() + ": " + accesses;
    }
}
