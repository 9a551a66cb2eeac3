package com.registry.depgraph.api;

/** A (contractId, versionLabel) pair was published twice. */
public class DuplicateVersionException extends DependencyGraphException {
    private final String contractId;
    private final String versionLabel;

    public DuplicateVersionException(String contractId, String versionLabel) {
        super("Version already published: " + contractId + "@" + versionLabel);
        this.contractId = contractId;
        this.versionLabel = versionLabel;
    }

    public String contractId() {
        return contractId;
    }

    public String versionLabel() {
        return versionLabel;
    }
}
