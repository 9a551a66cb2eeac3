package com.registry.depgraph.api;

/** Committing the candidate edges would close a cycle over version nodes. */
public class CycleDetectedException extends DependencyGraphException {
    private final CyclePath path;

    public CycleDetectedException(CyclePath path) {
        super("Cycle detected: " + path);
        this.path = path;
    }

    public CyclePath path() {
        return path;
    }
}
