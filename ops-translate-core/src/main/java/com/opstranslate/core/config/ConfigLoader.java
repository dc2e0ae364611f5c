package com.opstranslate.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads ops-translate configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code ops-translate.yaml} into {@link TranslatorConfig}.
 * If the file is missing or invalid, returns {@link TranslatorConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TranslatorConfig config = ConfigLoader.load(Path.of("ops-translate.yaml"));
 * int workers = config.translation().parallelism();
 * }</pre>
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "ops-translate.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL);

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs and returns defaults.
     *
     * @param configPath path to {@code ops-translate.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static TranslatorConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return TranslatorConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return TranslatorConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            TranslatorConfig config = YAML_MAPPER.readValue(configPath.toFile(), TranslatorConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return TranslatorConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return TranslatorConfig.defaults();
        }
    }
}
