package org.psyforge.compiler.transformations;

import org.psyforge.compiler.analysis.VariablesAccessInfo;
import org.psyforge.compiler.api.TransformationException;
import org.psyforge.compiler.ir.Loop;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.directives.ParallelDirective;
import org.psyforge.compiler.symbols.DataSymbol;
import org.psyforge.compiler.symbols.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Encloses statements in an OpenMP parallel region. Loop variables and scalars that the region
 * writes before reading become private; everything else stays shared.
 */
public class ParallelRegionTrans extends RegionTrans<ParallelDirective> {

    @Override
    protected void validateRegion(List<Node> nodes) {
        if (nodes.get(0).ancestor(ParallelDirective.class).isPresent()) {
            throw new TransformationException(String.format(
                    "Error in %s: cannot create an OpenMP parallel region inside another parallel region.", getName()));
        }
    }

    @Override
    protected ParallelDirective createDirective(List<Node> nodes) {
        ParallelDirective directive = ParallelDirective.create();
        directive.setPrivateSymbols(privateSymbols(nodes));
        return directive;
    }

    /**
     * @param nodes The statements of a region.
     * @return The loop variables and the scalars written before being read, in order of first access.
     */
    static List<DataSymbol> privateSymbols(List<Node> nodes) {
        Set<Symbol> loopVariables = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Node node : nodes) {
            node.walk(Loop.class).forEach(loop -> loopVariables.add(loop.getVariable()));
        }
        VariablesAccessInfo info = VariablesAccessInfo.of(nodes);
        List<DataSymbol> result = new ArrayList<>();
        for (Symbol symbol : info.symbols()) {
            if (symbol instanceof DataSymbol data && !data.isArray()
                    && (loopVariables.contains(symbol) || info.get(symbol).isWrittenFirst())) {
                result.add(data);
            }
        }
        return result;
    }
}
