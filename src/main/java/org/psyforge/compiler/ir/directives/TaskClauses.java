package org.psyforge.compiler.ir.directives;

import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.symbols.Symbol;

import java.util.List;

/**
 * The data-sharing and dependency clauses of a task.
 *
 * @param privateSymbols Variables each task gets an uninitialised copy of.
 * @param firstprivateSymbols Variables each task gets a copy of, initialised at task creation.
 * @param sharedSymbols Variables all tasks access directly.
 * @param dependIn Storage the task reads and that earlier tasks may write.
 * @param dependOut Storage the task writes.
 */
public record TaskClauses(
        List<Symbol> privateSymbols,
        List<Symbol> firstprivateSymbols,
        List<Symbol> sharedSymbols,
        List<Node> dependIn,
        List<Node> dependOut
) {
    public TaskClauses {
        privateSymbols = List.copyOf(privateSymbols);
        firstprivateSymbols = List.copyOf(firstprivateSymbols);
        sharedSymbols = List.copyOf(sharedSymbols);
        dependIn = List.copyOf(dependIn);
        dependOut = List.copyOf(dependOut);
    }

    /**
     * @return A clause set with every list empty.
     */
    public static TaskClauses empty() {
        return new TaskClauses(List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
