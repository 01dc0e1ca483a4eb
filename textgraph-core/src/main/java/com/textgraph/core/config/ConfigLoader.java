package com.textgraph.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading textgraph configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code textgraph.yaml} into a {@link RenderConfig}.
 * If the file is missing or invalid, returns {@link RenderConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RenderConfig config = ConfigLoader.load(Paths.get("textgraph.yaml"));
 * String diagram = TextGraph.renderSource(source, config);
 * }</pre>
 */
public class ConfigLoader {

    /** Conventional file name looked up in the working directory. */
    public static final String DEFAULT_FILE_NAME = "textgraph.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs the problem and returns
     * {@link RenderConfig#defaults()}.
     *
     * @param configPath path to {@code textgraph.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static RenderConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return RenderConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return RenderConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            RenderConfig config = YAML_MAPPER.readValue(configPath.toFile(), RenderConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return RenderConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return RenderConfig.defaults();
        }
    }
}
