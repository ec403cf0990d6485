package org.psyforge.compiler.transformations;

import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.Reference;
import org.psyforge.compiler.symbols.Symbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Helpers for telling active from passive code in tangent-linear and adjoint rewrites.
 * A variable is active if its value depends on the inputs being differentiated.
 */
public final class AdjointUtils {

    private AdjointUtils() {
    }

    /**
     * @param node A subtree.
     * @param active The active symbols, compared by identity.
     * @return true if any reference in the subtree points at an active symbol.
     */
    public static boolean isActive(Node node, Collection<? extends Symbol> active) {
        return node.walk(Reference.class).stream().anyMatch(reference -> contains(active, reference.getSymbol()));
    }

    public static boolean isPassive(Node node, Collection<? extends Symbol> active) {
        return !isActive(node, active);
    }

    /**
     * Collects the active references of a subtree without descending into references, so an
     * active variable used as an array index of another reference is not counted separately.
     *
     * @param node A subtree.
     * @param active The active symbols.
     * @return The outermost references to active symbols, in tree order.
     */
    static List<Reference> activeReferences(Node node, Collection<? extends Symbol> active) {
        List<Reference> result = new ArrayList<>();
        collect(node, active, result);
        return result;
    }

    private static void collect(Node node, Collection<? extends Symbol> active, List<Reference> result) {
        if (node instanceof Reference reference) {
            if (contains(active, reference.getSymbol())) {
                result.add(reference);
            }
            return;
        }
        for (Node child : node.getChildren()) {
            collect(child, active, result);
        }
    }

    private static boolean contains(Collection<? extends Symbol> symbols, Symbol symbol) {
        for (Symbol candidate : symbols) {
            if (candidate == symbol) {
                return true;
            }
        }
        return false;
    }
}
