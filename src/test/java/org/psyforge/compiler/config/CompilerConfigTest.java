package org.psyforge.compiler.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.psyforge.compiler.api.GenerationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the typed view of the configuration and its fallback to {@code reference.conf}.
 */
@Tag("unit")
class CompilerConfigTest {

    /**
     * Verifies the defaults shipped in {@code reference.conf}.
     */
    @Test
    void readsDefaults() {
        // Act
        CompilerConfig config = CompilerConfig.fromConfig(ConfigFactory.empty());

        // Assert
        assertThat(config.isSpecializeLoops()).isTrue();
        assertThat(config.getLoopTypes().typeOf("JI")).contains("lon");
        assertThat(config.getLoopTypes().typeOf("jn")).isEmpty();
        assertThat(config.getProfilingOptions().options()).isEmpty();
        assertThat(config.getMetadataApi()).isEqualTo("gocean");
        assertThat(config.getMetadataApiConfig("lfric").getStringList("access-modes")).contains("gh_inc", "gh_sum");
        assertThat(config.raw().getString("logging.default-level")).isEqualTo("INFO");
    }

    /**
     * Verifies that explicit values are merged over the defaults.
     */
    @Test
    void overridesAreMergedWithDefaults() {
        // Arrange
        String hocon = """
                psyforge {
                  pipeline.specialize-loops = false
                  loops.types { jn = levels }
                  profiling.options = [Kernels]
                  metadata.default-api = lfric
                }
                """;

        // Act
        CompilerConfig config = CompilerConfig.fromConfig(ConfigFactory.parseString(hocon));

        // Assert
        assertThat(config.isSpecializeLoops()).isFalse();
        assertThat(config.getLoopTypes().typeOf("jn")).contains("levels");
        assertThat(config.getLoopTypes().typeOf("jj")).contains("lat");
        assertThat(config.getProfilingOptions().kernels()).isTrue();
        assertThat(config.getProfilingOptions().invokes()).isFalse();
        assertThat(config.getMetadataApi()).isEqualTo("lfric");
    }

    /**
     * Verifies the failures for an unknown profiling option and an unconfigured API.
     */
    @Test
    void rejectsInvalidValues() {
        // Arrange
        CompilerConfig config = CompilerConfig.fromConfig(ConfigFactory.empty());

        // Act & Assert
        assertThatThrownBy(() -> CompilerConfig.fromConfig(ConfigFactory.parseString("psyforge.profiling.options = [all]")))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Error in Profiler.set_options: options must be one of [invokes, kernels] but found 'all' at index 0");
        assertThatThrownBy(() -> config.getMetadataApiConfig("nemo"))
                .isInstanceOf(ConfigException.Missing.class);
    }
}
