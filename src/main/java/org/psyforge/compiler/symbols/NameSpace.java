package org.psyforge.compiler.symbols;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Hands out names that are unique for the lifetime of one compilation run, for example the
 * names of profiling regions. One instance is created per run and passed to whoever needs it.
 * Not thread-safe; the compiler runs its passes sequentially.
 */
public class NameSpace {

    private final Set<String> used = new HashSet<>();

    /**
     * Returns {@code base} (lower case) on first use and {@code base_1}, {@code base_2}, ... afterwards.
     * @param base A human-readable base name.
     * @return A name that has not been returned before by this namespace.
     */
    public String createName(String base) {
        String root = base.toLowerCase(Locale.ROOT);
        String candidate = root;
        int suffix = 1;
        while (!used.add(candidate)) {
            candidate = root + "_" + suffix++;
        }
        return candidate;
    }

    /**
     * Marks an externally chosen name as taken.
     * @param name The name.
     * @return true if the name was still free.
     */
    public boolean reserve(String name) {
        return used.add(name.toLowerCase(Locale.ROOT));
    }
}
