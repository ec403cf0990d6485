package org.psyforge.compiler.metadata;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.config.CompilerConfig;

import java.util.List;
import java.util.Locale;

/**
 * The closed value sets of one kernel API, read from {@code psyforge.metadata.apis.<api>}.
 * All values are lower case.
 */
public record MetadataVocabulary(
        String api,
        String argumentConstructor,
        List<String> accessModes,
        List<String> gridProperties,
        List<String> functionSpaces,
        List<String> scalarDatatypes,
        List<String> operatorDatatypes,
        List<String> operatorForms,
        List<String> stencilNames,
        String stencilConstructor,
        List<String> iterationSpaces,
        List<String> offsets
) {

    public MetadataVocabulary {
        argumentConstructor = argumentConstructor.toLowerCase(Locale.ROOT);
        stencilConstructor = stencilConstructor.toLowerCase(Locale.ROOT);
        accessModes = lower(accessModes);
        gridProperties = lower(gridProperties);
        functionSpaces = lower(functionSpaces);
        scalarDatatypes = lower(scalarDatatypes);
        operatorDatatypes = lower(operatorDatatypes);
        operatorForms = lower(operatorForms);
        stencilNames = lower(stencilNames);
        iterationSpaces = lower(iterationSpaces);
        offsets = lower(offsets);
    }

    /**
     * @param config The compiler configuration.
     * @param api The API name, e.g. {@code gocean} or {@code lfric}.
     * @return The vocabulary of that API.
     * @throws GenerationException if the API is not configured or its block is incomplete.
     */
    public static MetadataVocabulary fromConfig(CompilerConfig config, String api) {
        final Config block;
        try {
            block = config.getMetadataApiConfig(api);
        } catch (ConfigException e) {
            throw new GenerationException("No kernel metadata vocabulary is configured for API '" + api + "'.", e);
        }
        try {
            return new MetadataVocabulary(
                    api,
                    block.getString("argument-constructor"),
                    block.getStringList("access-modes"),
                    block.getStringList("grid-properties"),
                    block.getStringList("function-spaces"),
                    block.getStringList("scalar-datatypes"),
                    block.getStringList("operator-datatypes"),
                    block.getStringList("operator-forms"),
                    block.getStringList("stencil-names"),
                    block.getString("stencil-constructor"),
                    block.getStringList("iteration-spaces"),
                    block.getStringList("offsets"));
        } catch (ConfigException e) {
            throw new GenerationException("Incomplete kernel metadata vocabulary for API '" + api + "': " + e.getMessage(), e);
        }
    }

    /**
     * Formats a value set the way error messages show it: {@code ['go_cu', 'go_cv']}.
     */
    static String choices(List<String> values) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append('\'').append(values.get(i)).append('\'');
        }
        return sb.append(']').toString();
    }

    private static List<String> lower(List<String> values) {
        return values.stream().map(value -> value.toLowerCase(Locale.ROOT)).toList();
    }
}
