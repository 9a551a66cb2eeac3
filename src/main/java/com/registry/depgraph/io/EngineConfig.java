package com.registry.depgraph.io;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Engine settings, bound from JSON by {@link EngineConfigLoader}.
 *
 * <pre>
 * {
 *   "ringBufferSize": 1024,
 *   "waitStrategy": "blocking",
 *   "cacheEnabled": true,
 *   "cacheMaxEntries": 10000,
 *   "commitLogPath": "data/commits.jsonl",
 *   "maxTreeDepth": 16
 * }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    /** Slots in the publication ring buffer. Must be a power of two. */
    private int ringBufferSize = 1024;
    /** Consumer wait strategy: blocking, yielding or sleeping. */
    private String waitStrategy = "blocking";
    private boolean cacheEnabled = true;
    /** Size bound of the result cache. */
    private long cacheMaxEntries = 10_000;
    /** JSON-lines commit log; null keeps the graph in memory only. */
    private String commitLogPath;
    /** Depth cap for dependency trees. */
    private int maxTreeDepth = 16;

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Checks value ranges and normalizes {@code waitStrategy} to lower case
     * (null means blocking).
     *
     * @throws IllegalArgumentException on the first invalid setting
     */
    public EngineConfig validate() {
        if (ringBufferSize < 1 || Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of two: " + ringBufferSize);
        if (maxTreeDepth < 0)
            throw new IllegalArgumentException("maxTreeDepth must be >= 0: " + maxTreeDepth);
        if (cacheMaxEntries < 1)
            throw new IllegalArgumentException("cacheMaxEntries must be >= 1: " + cacheMaxEntries);
        waitStrategy = waitStrategy == null ? "blocking" : waitStrategy.trim().toLowerCase(Locale.ROOT);
        switch (waitStrategy) {
            case "blocking", "yielding", "sleeping" -> {
            }
            default -> throw new IllegalArgumentException("Unknown waitStrategy: " + waitStrategy);
        }
        return this;
    }
}
