package org.psyforge.compiler.symbols;

import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.api.SymbolNotFoundException;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.ScopingNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The symbols declared in one scope. Names are case-insensitive. A lookup that misses here
 * continues in the table of the nearest enclosing scoping node.
 */
public class SymbolTable {

    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final List<DataSymbol> argumentList = new ArrayList<>();
    private ScopingNode node;

    /**
     * Creates a table that is not attached to a node yet.
     */
    public SymbolTable() {
    }

    /**
     * @return The node that owns this scope, or null if the table is detached.
     */
    public ScopingNode getNode() {
        return node;
    }

    /**
     * Called by {@link ScopingNode} when it takes ownership of this table.
     * @param node The owning node.
     */
    public void attach(ScopingNode node) {
        if (this.node != null && this.node != node) {
            throw new GenerationException(String.format(
                    "The symbol table is already bound to a '%s' node.", this.node.getClass().getSimpleName()));
        }
        this.node = node;
    }

    /**
     * @return The table of the nearest enclosing scope, if any.
     */
    public Optional<SymbolTable> getParentSymbolTable() {
        if (node == null) {
            return Optional.empty();
        }
        Node current = node.getParent();
        while (current != null) {
            if (current instanceof ScopingNode scoping) {
                return Optional.of(scoping.getSymbolTable());
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Adds a symbol to this scope.
     *
     * @param symbol The symbol to add.
     * @throws GenerationException if a symbol with the same name already exists in this scope.
     */
    public void add(Symbol symbol) {
        String key = key(symbol.getName());
        if (symbols.containsKey(key)) {
            throw new GenerationException(String.format(
                    "Symbol table already contains a symbol with name '%s'.", symbol.getName()));
        }
        symbols.put(key, symbol);
    }

    /**
     * Finds a symbol by name in this scope or any enclosing one.
     *
     * @param name The name, case-insensitive.
     * @return The symbol.
     * @throws SymbolNotFoundException if no scope declares the name.
     */
    public Symbol lookup(String name) {
        return lookup(name, null);
    }

    /**
     * Finds a symbol by name, searching no further out than {@code scopeLimit}.
     *
     * @param name The name, case-insensitive.
     * @param scopeLimit The outermost table to search, or null for no limit.
     * @return The symbol.
     * @throws SymbolNotFoundException if no searched scope declares the name.
     */
    public Symbol lookup(String name, SymbolTable scopeLimit) {
        SymbolTable table = this;
        while (table != null) {
            Symbol symbol = table.symbols.get(key(name));
            if (symbol != null) {
                return symbol;
            }
            if (table == scopeLimit) {
                break;
            }
            table = table.getParentSymbolTable().orElse(null);
        }
        throw new SymbolNotFoundException(String.format("Could not find '%s' in the Symbol Table.", name));
    }

    /**
     * Like {@link #lookup(String)} but without failing.
     * @param name The name, case-insensitive.
     * @return An optional containing the symbol, or empty if it is not declared.
     */
    public Optional<Symbol> resolve(String name) {
        SymbolTable table = this;
        while (table != null) {
            Symbol symbol = table.symbols.get(key(name));
            if (symbol != null) {
                return Optional.of(symbol);
            }
            table = table.getParentSymbolTable().orElse(null);
        }
        return Optional.empty();
    }

    /**
     * @param name The name, case-insensitive.
     * @return The symbol declared in this very scope, if any.
     */
    public Optional<Symbol> lookupLocal(String name) {
        return Optional.ofNullable(symbols.get(key(name)));
    }

    /**
     * @param name The name, case-insensitive.
     * @return true if this scope declares the name.
     */
    public boolean contains(String name) {
        return symbols.containsKey(key(name));
    }

    /**
     * Removes a symbol from this scope.
     *
     * @param symbol The symbol to remove.
     * @throws GenerationException if the symbol is not in this table, is an argument, or is still in use.
     */
    public void remove(Symbol symbol) {
        Symbol existing = symbols.get(key(symbol.getName()));
        if (existing != symbol) {
            throw new GenerationException(String.format(
                    "Cannot remove Symbol '%s' from symbol table because it does not exist.", symbol.getName()));
        }
        if (argumentList.contains(symbol)) {
            throw new GenerationException(String.format(
                    "Cannot remove Symbol '%s' because it is a routine argument.", symbol.getName()));
        }
        if (symbol instanceof ContainerSymbol container && !importsFrom(container).isEmpty()) {
            throw new GenerationException(String.format(
                    "Cannot remove ContainerSymbol '%s' because symbols are still imported from it: %s",
                    symbol.getName(), importsFrom(container).stream().map(Symbol::getName).toList()));
        }
        if (node != null && node.referencesSymbol(symbol)) {
            throw new GenerationException(String.format(
                    "Cannot remove Symbol '%s' because it is still referenced in the scope.", symbol.getName()));
        }
        symbols.remove(key(symbol.getName()));
    }

    /**
     * Renames a symbol of this scope.
     *
     * @param symbol The symbol to rename.
     * @param newName The new name.
     * @throws GenerationException if the symbol is not in this table or the new name is taken.
     */
    public void rename(Symbol symbol, String newName) {
        if (symbols.get(key(symbol.getName())) != symbol) {
            throw new GenerationException(String.format(
                    "The symbol '%s' must belong to this symbol table to be renamed.", symbol.getName()));
        }
        if (symbols.containsKey(key(newName))) {
            throw new GenerationException(String.format(
                    "The name '%s' is already in use in this symbol table.", newName));
        }
        Map<String, Symbol> reordered = new LinkedHashMap<>();
        for (Map.Entry<String, Symbol> entry : symbols.entrySet()) {
            if (entry.getValue() == symbol) {
                reordered.put(key(newName), symbol);
            } else {
                reordered.put(entry.getKey(), entry.getValue());
            }
        }
        symbol.setName(newName);
        symbols.clear();
        symbols.putAll(reordered);
    }

    /**
     * Puts {@code replacement} in the place of a symbol of the same name.
     *
     * @param symbol The symbol to replace.
     * @param replacement The new symbol.
     * @throws GenerationException if the symbol is not in this table, is an argument, or the names differ.
     */
    public void replace(Symbol symbol, Symbol replacement) {
        String key = key(symbol.getName());
        if (symbols.get(key) != symbol) {
            throw new GenerationException(String.format(
                    "The symbol '%s' must belong to this symbol table to be replaced.", symbol.getName()));
        }
        if (!key.equals(key(replacement.getName()))) {
            throw new GenerationException(String.format(
                    "Cannot replace Symbol '%s' by a symbol with the different name '%s'.",
                    symbol.getName(), replacement.getName()));
        }
        if (argumentList.contains(symbol)) {
            throw new GenerationException(String.format(
                    "Cannot replace Symbol '%s' because it is a routine argument.", symbol.getName()));
        }
        symbols.put(key, replacement);
    }

    /**
     * @return All symbols of this scope, in declaration order.
     */
    public List<Symbol> getSymbols() {
        return List.copyOf(symbols.values());
    }

    public List<DataSymbol> getDataSymbols() {
        return symbols.values().stream()
                .filter(DataSymbol.class::isInstance)
                .map(DataSymbol.class::cast)
                .toList();
    }

    public List<ContainerSymbol> getContainerSymbols() {
        return symbols.values().stream()
                .filter(ContainerSymbol.class::isInstance)
                .map(ContainerSymbol.class::cast)
                .toList();
    }

    /**
     * @return The data symbols of this scope that are neither arguments nor imports.
     */
    public List<DataSymbol> getLocalDataSymbols() {
        return getDataSymbols().stream().filter(Symbol::isLocal).toList();
    }

    /**
     * @param container A module this scope imports from.
     * @return The symbols of this scope imported from that module.
     */
    public List<Symbol> importsFrom(ContainerSymbol container) {
        return symbols.values().stream()
                .filter(s -> s.getInterface() instanceof ImportInterface imported && imported.container() == container)
                .toList();
    }

    /**
     * @return The dummy arguments of the routine, in call order.
     */
    public List<DataSymbol> getArgumentList() {
        return Collections.unmodifiableList(argumentList);
    }

    /**
     * Replaces the argument list.
     *
     * @param arguments The arguments, all declared in this table with an {@link ArgumentInterface}.
     * @throws GenerationException if an argument is not in this table or has another interface.
     */
    public void setArgumentList(List<DataSymbol> arguments) {
        for (DataSymbol argument : arguments) {
            if (symbols.get(key(argument.getName())) != argument) {
                throw new GenerationException(String.format(
                        "Argument '%s' is not declared in this symbol table.", argument.getName()));
            }
            if (!argument.isArgument()) {
                throw new GenerationException(String.format(
                        "Symbol '%s' is listed as a routine argument but has interface '%s'.",
                        argument.getName(), argument.getInterface()));
            }
        }
        argumentList.clear();
        argumentList.addAll(arguments);
    }

    /**
     * Generates a name based on {@code base} that clashes with no symbol visible from this scope.
     * @param base The preferred name.
     * @return {@code base} itself if free, otherwise {@code base_1}, {@code base_2}, ...
     */
    public String nextAvailableName(String base) {
        String candidate = base;
        int suffix = 1;
        while (resolve(candidate).isPresent()) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    /**
     * @return A detached table holding the same symbol objects and argument list.
     */
    public SymbolTable shallowCopy() {
        SymbolTable copy = new SymbolTable();
        copy.symbols.putAll(symbols);
        copy.argumentList.addAll(argumentList);
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Symbol Table");
        if (node != null) {
            sb.append(" of ").append(node.getClass().getSimpleName());
        }
        sb.append(":\n");
        symbols.values().forEach(s -> sb.append(s).append('\n'));
        return sb.toString();
    }
}
