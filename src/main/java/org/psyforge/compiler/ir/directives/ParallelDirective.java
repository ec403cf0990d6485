package org.psyforge.compiler.ir.directives;

import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.symbols.DataSymbol;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * {@code !$omp parallel default(shared), private(...)}.
 */
public class ParallelDirective extends RegionDirective {

    private List<DataSymbol> privateSymbols = List.of();

    ParallelDirective() {
    }

    /**
     * @return A directive with an empty body.
     */
    public static ParallelDirective create() {
        ParallelDirective directive = new ParallelDirective();
        directive.initBody();
        return directive;
    }

    public List<DataSymbol> getPrivateSymbols() {
        return privateSymbols;
    }

    /**
     * @param privateSymbols The scalars private to each thread; stored sorted by name.
     */
    public void setPrivateSymbols(List<DataSymbol> privateSymbols) {
        this.privateSymbols = privateSymbols.stream()
                .sorted(Comparator.comparing(s -> s.getName().toLowerCase(Locale.ROOT)))
                .toList();
    }

    @Override
    public String beginString() {
        String clause = "omp parallel default(shared)";
        if (!privateSymbols.isEmpty()) {
            clause += ", private(" + privateSymbols.stream().map(DataSymbol::getName).collect(Collectors.joining(",")) + ")";
        }
        return clause;
    }

    @Override
    public String endString() {
        return "omp end parallel";
    }

    @Override
    protected Node shallowCopy() {
        ParallelDirective copy = new ParallelDirective();
        copy.privateSymbols = privateSymbols;
        return copy;
    }

    @Override
    protected boolean hasSameData(Node other) {
        return privateSymbols.equals(((ParallelDirective) other).privateSymbols);
    }
}
