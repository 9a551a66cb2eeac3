package com.registry.depgraph.api;

/**
 * Base type of every domain failure the engine reports. None of them are fatal:
 * the engine stays usable after any single failure.
 */
public class DependencyGraphException extends RuntimeException {
    public DependencyGraphException(String message) {
        super(message);
    }

    public DependencyGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
