package org.psyforge.compiler.modules;

import org.psyforge.compiler.api.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the source files of modules in a list of search directories and answers dependency
 * questions about them. A module {@code m} is expected in a file named {@code m.f90} or
 * {@code m.F90}; names are compared case-insensitively and the first directory holding a
 * match wins.
 */
public class ModuleManager {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleManager.class);
    private static final String EXTENSION = ".f90";

    private final List<Path> searchPaths;
    private final Map<String, ModuleInfo> modules = new HashMap<>();
    private boolean scanned;

    /**
     * @param searchPaths The directories to search, in priority order.
     */
    public ModuleManager(List<Path> searchPaths) {
        this.searchPaths = List.copyOf(searchPaths);
    }

    public List<Path> getSearchPaths() {
        return searchPaths;
    }

    /**
     * @param moduleName A module name, case-insensitive.
     * @return The information of the module.
     * @throws FileNotFoundException if no search directory holds a file for the module.
     */
    public ModuleInfo getModuleInfo(String moduleName) throws FileNotFoundException {
        return findModuleInfo(moduleName).orElseThrow(() -> new FileNotFoundException(String.format(
                "Could not find source file for module '%s' in any of the directories '%s'.",
                moduleName, searchPaths.stream().map(Path::toString).collect(Collectors.joining(", ")))));
    }

    /**
     * @param moduleName A module name, case-insensitive.
     * @return The information of the module, if its file was found.
     */
    public Optional<ModuleInfo> findModuleInfo(String moduleName) {
        scan();
        return Optional.ofNullable(modules.get(moduleName.toLowerCase(Locale.ROOT)));
    }

    /**
     * Collects every module reachable through {@code use} statements. Modules without a source
     * file are included but their own dependencies cannot be followed.
     *
     * @param moduleName The starting module.
     * @return The names of all direct and indirect dependencies in lower case, in discovery order.
     * @throws IOException if a module source cannot be read.
     */
    public Set<String> getAllDependencies(String moduleName) throws IOException {
        String start = moduleName.toLowerCase(Locale.ROOT);
        Set<String> found = new LinkedHashSet<>();
        Deque<String> todo = new ArrayDeque<>();
        todo.add(start);
        while (!todo.isEmpty()) {
            String current = todo.poll();
            for (String used : directDependencies(current)) {
                if (!used.equals(start) && found.add(used)) {
                    todo.add(used);
                }
            }
        }
        return found;
    }

    /**
     * Orders modules so that every module comes after the modules it uses. Dependencies on modules
     * outside the given list are ignored.
     *
     * @param moduleNames The modules to sort.
     * @return The names in lower case, dependencies first; ties keep the input order.
     * @throws GenerationException if the modules depend on each other in a cycle.
     * @throws IOException if a module source cannot be read.
     */
    public List<String> sortModules(List<String> moduleNames) throws IOException {
        Map<String, Set<String>> pending = new LinkedHashMap<>();
        for (String name : moduleNames) {
            pending.put(name.toLowerCase(Locale.ROOT), new LinkedHashSet<>());
        }
        for (Map.Entry<String, Set<String>> entry : pending.entrySet()) {
            for (String used : directDependencies(entry.getKey())) {
                if (pending.containsKey(used) && !used.equals(entry.getKey())) {
                    entry.getValue().add(used);
                }
            }
        }
        List<String> sorted = new ArrayList<>();
        while (!pending.isEmpty()) {
            String next = pending.entrySet().stream()
                    .filter(entry -> entry.getValue().isEmpty())
                    .map(Map.Entry::getKey)
                    .findFirst()
                    .orElseThrow(() -> new GenerationException(
                            "Circular dependency between modules: " + String.join(", ", pending.keySet())));
            pending.remove(next);
            pending.values().forEach(dependencies -> dependencies.remove(next));
            sorted.add(next);
        }
        return sorted;
    }

    private Set<String> directDependencies(String moduleName) throws IOException {
        Optional<ModuleInfo> info = findModuleInfo(moduleName);
        if (info.isEmpty()) {
            LOG.debug("No source file for module '{}', its dependencies are not followed.", moduleName);
            return Set.of();
        }
        Set<String> used = new LinkedHashSet<>();
        for (ModuleUse use : info.get().getUsedModules()) {
            used.add(use.moduleName().toLowerCase(Locale.ROOT));
        }
        return used;
    }

    private void scan() {
        if (scanned) {
            return;
        }
        for (Path directory : searchPaths) {
            if (!Files.isDirectory(directory)) {
                LOG.warn("Module search path '{}' is not a directory and is ignored.", directory);
                continue;
            }
            try (Stream<Path> files = Files.list(directory)) {
                files.filter(Files::isRegularFile)
                        .filter(file -> file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION))
                        .sorted()
                        .forEach(file -> {
                            String fileName = file.getFileName().toString();
                            String name = fileName.substring(0, fileName.length() - EXTENSION.length()).toLowerCase(Locale.ROOT);
                            modules.putIfAbsent(name, new ModuleInfo(name, file));
                        });
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list module search path " + directory, e);
            }
        }
        scanned = true;
        LOG.debug("Found {} module file(s) in {} search path(s).", modules.size(), searchPaths.size());
    }
}
