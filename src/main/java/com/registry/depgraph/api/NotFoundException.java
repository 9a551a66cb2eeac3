package com.registry.depgraph.api;

/** A query named a contract or version absent from the snapshot. */
public class NotFoundException extends DependencyGraphException {
    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException contract(String contractId) {
        return new NotFoundException("Unknown contract: " + contractId);
    }

    public static NotFoundException version(String contractId, String versionLabel) {
        return new NotFoundException("Unknown version: " + contractId + "@" + versionLabel);
    }
}
