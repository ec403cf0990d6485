package org.psyforge.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view of the {@code psyforge} configuration block.
 */
public final class CompilerConfig {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerConfig.class);
    private static final String CONFIG_FILE_NAME = "psyforge.conf";
    private static final String ROOT = "psyforge";

    private final Config config;
    private final LoopTypeMapping loopTypes;
    private final ProfilingOptions profilingOptions;
    private final boolean specializeLoops;
    private final String metadataApi;

    private CompilerConfig(Config config) {
        this.config = config;
        Config root = config.getConfig(ROOT);
        Map<String, String> types = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : root.getConfig("loops.types").root().entrySet()) {
            types.put(entry.getKey(), entry.getValue().unwrapped().toString());
        }
        this.loopTypes = new LoopTypeMapping(types);
        this.profilingOptions = new ProfilingOptions(root.getStringList("profiling.options"));
        this.specializeLoops = root.getBoolean("pipeline.specialize-loops");
        this.metadataApi = root.getString("metadata.default-api");
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment variables
     * 2. Java system properties ({@code -Dkey=value})
     * 3. {@code psyforge.conf} in the working directory
     * 4. {@code reference.conf} on the classpath
     *
     * @return The merged and resolved configuration.
     */
    public static CompilerConfig load() {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found, using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return fromConfig(envConfig
                .withFallback(propertiesConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve());
    }

    /**
     * Wraps an explicit configuration. Keys missing from it are taken from {@code reference.conf}.
     *
     * @param config A configuration, usually built by a test.
     * @return The typed view.
     */
    public static CompilerConfig fromConfig(Config config) {
        return new CompilerConfig(config.withFallback(ConfigFactory.parseResources("reference.conf")).resolve());
    }

    public Config raw() {
        return config;
    }

    public LoopTypeMapping getLoopTypes() {
        return loopTypes;
    }

    public ProfilingOptions getProfilingOptions() {
        return profilingOptions;
    }

    public boolean isSpecializeLoops() {
        return specializeLoops;
    }

    /**
     * @return The API whose metadata vocabulary is used when none is named explicitly.
     */
    public String getMetadataApi() {
        return metadataApi;
    }

    /**
     * @param api The name of a block under {@code psyforge.metadata.apis}.
     * @return The configuration of that API.
     * @throws com.typesafe.config.ConfigException.Missing if the API is not configured.
     */
    public Config getMetadataApiConfig(String api) {
        return config.getConfig(ROOT + ".metadata.apis." + api);
    }
}
