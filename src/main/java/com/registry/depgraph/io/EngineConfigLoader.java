package com.registry.depgraph.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Loads {@link EngineConfig} from JSON.
 *
 * <p>
 * A missing file or resource falls back to {@link EngineConfig#defaults()}; a
 * present but unparsable one is an error, since silently ignoring a typo in
 * e.g. {@code commitLogPath} would lose data.
 */
public final class EngineConfigLoader {
    private static final Logger log = LogManager.getLogger(EngineConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Classpath resource consulted by {@link #loadDefault()}. */
    public static final String DEFAULT_RESOURCE = "depgraph.json";

    private EngineConfigLoader() {
        // Utility class
    }

    public static EngineConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            log.warn("Configuration file not found: {}. Using defaults.", path);
            return EngineConfig.defaults();
        }
        try {
            EngineConfig config = MAPPER.readValue(path.toFile(), EngineConfig.class).validate();
            log.info("Loaded configuration from {}", path);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse configuration " + path, e);
        }
    }

    public static EngineConfig parse(String json) {
        try {
            return MAPPER.readValue(json, EngineConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse configuration", e);
        }
    }

    /** Loads {@value #DEFAULT_RESOURCE} from the classpath, or defaults. */
    public static EngineConfig loadDefault() {
        try (InputStream in = EngineConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", DEFAULT_RESOURCE);
                return EngineConfig.defaults();
            }
            return MAPPER.readValue(in, EngineConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse classpath configuration " + DEFAULT_RESOURCE, e);
        }
    }
}
