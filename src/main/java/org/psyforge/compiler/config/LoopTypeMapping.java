package org.psyforge.compiler.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps loop variable names to domain loop types, e.g. {@code ji -> lon}.
 */
public final class LoopTypeMapping {

    private final Map<String, String> types;

    public LoopTypeMapping(Map<String, String> types) {
        Map<String, String> normalised = new LinkedHashMap<>();
        types.forEach((variable, type) -> normalised.put(variable.toLowerCase(Locale.ROOT), type));
        this.types = Collections.unmodifiableMap(normalised);
    }

    /**
     * @param variableName The name of a loop variable, case-insensitive.
     * @return The configured loop type, if any.
     */
    public Optional<String> typeOf(String variableName) {
        return Optional.ofNullable(types.get(variableName.toLowerCase(Locale.ROOT)));
    }

    public Map<String, String> asMap() {
        return types;
    }
}
