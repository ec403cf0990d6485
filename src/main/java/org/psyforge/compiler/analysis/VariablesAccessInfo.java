package org.psyforge.compiler.analysis;

import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.symbols.Symbol;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read/write information for all symbols accessed in a set of nodes. Symbols are keyed by
 * identity and kept in order of first access.
 */
public class VariablesAccessInfo {

    private final Map<Symbol, SingleVariableAccessInfo> accesses = new IdentityHashMap<>();
    private final List<Symbol> order = new ArrayList<>();
    private int recorded;

    /**
     * Collects the accesses of the given nodes, in order.
     * @param nodes The subtrees to analyse.
     * @return The collected information.
     */
    public static VariablesAccessInfo of(Node... nodes) {
        return of(List.of(nodes));
    }

    public static VariablesAccessInfo of(List<? extends Node> nodes) {
        VariablesAccessInfo info = new VariablesAccessInfo();
        for (Node node : nodes) {
            node.referenceAccesses(info);
        }
        return info;
    }

    /**
     * Records one access.
     *
     * @param symbol The accessed symbol.
     * @param accessType How it is accessed.
     * @param node Where it is accessed.
     * @return The new access record, so that indices can be attached to it later.
     */
    public AccessInfo addAccess(Symbol symbol, AccessType accessType, Node node) {
        SingleVariableAccessInfo single = accesses.get(symbol);
        if (single == null) {
            single = new SingleVariableAccessInfo(symbol);
            accesses.put(symbol, single);
            order.add(symbol);
        }
        AccessInfo access = new AccessInfo(accessType, node);
        access.setSequence(recorded++);
        single.add(access);
        return access;
    }

    /**
     * @param symbol A symbol.
     * @return The accesses of that symbol; empty if it is not accessed.
     */
    public SingleVariableAccessInfo get(Symbol symbol) {
        SingleVariableAccessInfo single = accesses.get(symbol);
        return single != null ? single : new SingleVariableAccessInfo(symbol);
    }

    public boolean has(Symbol symbol) {
        return accesses.containsKey(symbol);
    }

    /**
     * @return The accessed symbols in order of first access.
     */
    public List<Symbol> symbols() {
        return List.copyOf(order);
    }

    /**
     * Appends all accesses of {@code other} after the ones already recorded.
     * @param other Information gathered from nodes that execute after the ones in this instance.
     */
    public void merge(VariablesAccessInfo other) {
        List<Map.Entry<Symbol, AccessInfo>> sequence = new ArrayList<>();
        for (Symbol symbol : other.order) {
            for (AccessInfo access : other.accesses.get(symbol).getAccesses()) {
                sequence.add(Map.entry(symbol, access));
            }
        }
        sequence.sort(Comparator.comparingInt(entry -> entry.getValue().getSequence()));
        for (Map.Entry<Symbol, AccessInfo> entry : sequence) {
            AccessInfo access = entry.getValue();
            AccessInfo copy = addAccess(entry.getKey(), access.getAccessType(), access.getNode());
            copy.setIndices(access.getIndices());
        }
    }

    @Override
    public String toString() {
        return order.stream()
                .map(symbol -> {
                    SingleVariableAccessInfo single = accesses.get(symbol);
                    String mode = single.isWritten() && single.isRead() ? "READ+WRITE"
                            : single.isWritten() ? "WRITE"
                            : single.isRead() ? "READ" : "INQUIRY";
                    return symbol.getName() + ": " + mode;
                })
                .collect(Collectors.joining(", "));
    }
}
