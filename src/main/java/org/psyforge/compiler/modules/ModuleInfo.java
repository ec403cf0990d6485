package org.psyforge.compiler.modules;

import org.psyforge.compiler.diagnostics.DiagnosticsEngine;
import org.psyforge.compiler.frontend.FortranReader;
import org.psyforge.compiler.ir.Container;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.ScopingNode;
import org.psyforge.compiler.symbols.ContainerSymbol;
import org.psyforge.compiler.symbols.Symbol;
import org.psyforge.compiler.symbols.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cached information about one module: its file, its source text, its parse tree and the
 * modules it uses. Each item is computed on first request.
 */
public class ModuleInfo {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleInfo.class);

    private final String name;
    private final Path file;
    private String sourceCode;
    private Container parseTree;
    private List<ModuleUse> usedModules;

    /**
     * @param name The module name.
     * @param file The source file holding the module.
     */
    public ModuleInfo(String name, Path file) {
        this.name = name;
        this.file = file;
    }

    public String getName() {
        return name;
    }

    public Path getFile() {
        return file;
    }

    /**
     * @return The source text, read on the first call.
     * @throws FileNotFoundException if the file does not exist.
     * @throws IOException if the file cannot be read.
     */
    public String getSourceCode() throws IOException {
        if (sourceCode == null) {
            try {
                sourceCode = Files.readString(file);
            } catch (NoSuchFileException e) {
                FileNotFoundException missing = new FileNotFoundException(String.format(
                        "Could not find file '%s' when trying to read source code for module '%s'", file, name));
                missing.initCause(e);
                throw missing;
            }
        }
        return sourceCode;
    }

    /**
     * @return The IR of the whole file, parsed on the first call.
     * @throws IOException if the source cannot be read.
     */
    public Container getParseTree() throws IOException {
        if (parseTree == null) {
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            parseTree = new FortranReader(diagnostics, file.toString()).psyirFromSource(getSourceCode());
            if (diagnostics.hasErrors()) {
                LOG.warn("Module '{}' was read with {} error(s):\n{}", name, diagnostics.errorCount(), diagnostics.summary());
            }
        }
        return parseTree;
    }

    /**
     * Lists the {@code use} statements of every scope in the file. Intrinsic modules are not listed.
     *
     * @return One entry per used module and scope, in source order.
     * @throws IOException if the source cannot be read.
     */
    public List<ModuleUse> getUsedModules() throws IOException {
        if (usedModules == null) {
            List<ModuleUse> uses = new ArrayList<>();
            for (Node node : getParseTree().walk(Node.class)) {
                if (node instanceof ScopingNode scope) {
                    SymbolTable table = scope.getSymbolTable();
                    for (ContainerSymbol container : table.getContainerSymbols()) {
                        List<String> symbols = container.hasWildcardImport() ? List.of()
                                : table.importsFrom(container).stream().map(Symbol::getName).toList();
                        uses.add(new ModuleUse(container.getName(), symbols));
                    }
                }
            }
            usedModules = Collections.unmodifiableList(uses);
        }
        return usedModules;
    }

    @Override
    public String toString() {
        return "ModuleInfo[" + name + " -> " + file + "]";
    }
}
