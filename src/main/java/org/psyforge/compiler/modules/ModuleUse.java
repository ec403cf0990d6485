package org.psyforge.compiler.modules;

import java.util.List;

/**
 * One {@code use} of a module.
 *
 * @param moduleName The name of the used module.
 * @param symbols The imported names; empty if everything is imported.
 */
public record ModuleUse(String moduleName, List<String> symbols) {

    public ModuleUse {
        symbols = List.copyOf(symbols);
    }

    /**
     * @return true if the use imports every public name of the module.
     */
    public boolean importsAll() {
        return symbols.isEmpty();
    }
}
