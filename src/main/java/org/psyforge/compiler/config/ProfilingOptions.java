package org.psyforge.compiler.config;

import org.psyforge.compiler.api.GenerationException;

import java.util.List;
import java.util.Locale;

/**
 * Where profiling regions are inserted automatically.
 *
 * @param options Any of {@code invokes} (one region per routine body) and {@code kernels}
 *                (one region per outermost kernel loop).
 */
public record ProfilingOptions(List<String> options) {

    public static final String INVOKES = "invokes";
    public static final String KERNELS = "kernels";
    private static final List<String> SUPPORTED = List.of(INVOKES, KERNELS);

    public ProfilingOptions {
        options = options == null ? List.of() : List.copyOf(options);
        for (int i = 0; i < options.size(); i++) {
            if (!SUPPORTED.contains(options.get(i).toLowerCase(Locale.ROOT))) {
                throw new GenerationException(String.format(
                        "Error in Profiler.set_options: options must be one of [%s] but found '%s' at index %d",
                        String.join(", ", SUPPORTED), options.get(i), i));
            }
        }
    }

    public static ProfilingOptions none() {
        return new ProfilingOptions(List.of());
    }

    public boolean invokes() {
        return contains(INVOKES);
    }

    public boolean kernels() {
        return contains(KERNELS);
    }

    private boolean contains(String option) {
        return options.stream().anyMatch(candidate -> candidate.equalsIgnoreCase(option));
    }
}
