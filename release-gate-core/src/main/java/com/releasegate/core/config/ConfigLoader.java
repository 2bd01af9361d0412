package com.releasegate.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Utility for loading release-gate configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code releasegate.yaml} into {@link ReleaseGateConfig} records.
 * If the config file is missing or invalid, returns {@link ReleaseGateConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ReleaseGateConfig config = ConfigLoader.load(Paths.get("releasegate.yaml"));
 * int threads = config.effectiveConcurrency();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "releasegate.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>A missing, unreadable, empty or malformed file never stops a run: the problem is logged
     * and {@link ReleaseGateConfig#defaults()} is returned instead.
     *
     * @param configPath path to {@code releasegate.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ReleaseGateConfig load(Path configPath) {
        ReleaseGateConfig config = read(configPath).orElseGet(ReleaseGateConfig::defaults);
        log.debug("Release gate settings: concurrency={}, timeout={}s, maxFileSize={} bytes, output={}",
            config.effectiveConcurrency(), config.effectiveTimeoutSeconds(),
            config.effectiveMaxFileSizeBytes(), config.effectiveOutputFormat());
        return config;
    }

    private static Optional<ReleaseGateConfig> read(Path configPath) {
        if (!Files.exists(configPath)) {
            log.info("No release gate config at {}, running with built-in settings", configPath);
            return Optional.empty();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Cannot read release gate config {}, running with built-in settings", configPath);
            return Optional.empty();
        }

        try {
            Optional<ReleaseGateConfig> config =
                Optional.ofNullable(YAML_MAPPER.readValue(configPath.toFile(), ReleaseGateConfig.class));
            if (config.isEmpty()) {
                log.warn("Release gate config {} has no settings, running with built-in settings", configPath);
            } else {
                log.info("Using release gate config {}", configPath);
            }
            return config;
        } catch (IOException e) {
            log.error("Ignoring malformed release gate config {}: {}", configPath, e.getMessage());
            return Optional.empty();
        }
    }
}
