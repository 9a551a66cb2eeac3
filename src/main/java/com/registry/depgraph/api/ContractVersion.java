package com.registry.depgraph.api;

import java.util.Comparator;
import java.util.Objects;

/**
 * A graph vertex: one published version of one contract.
 *
 * <p>
 * Identity in the graph is the pair (contractId, versionLabel); the interface
 * hash is carried for auditing. Instances are immutable and never removed, so
 * superseded versions stay queryable.
 *
 * @param contractId    stable contract identifier (address or namespaced id)
 * @param versionLabel  publisher-supplied version label
 * @param interfaceHash hex digest of the interface the version was published
 *                      with
 */
public record ContractVersion(String contractId, String versionLabel, String interfaceHash) {

    /** Orders by contract id, then version label. */
    public static final Comparator<ContractVersion> BY_ID = Comparator
            .comparing(ContractVersion::contractId)
            .thenComparing(ContractVersion::versionLabel);

    public ContractVersion {
        requireText(contractId, "contractId");
        requireText(versionLabel, "versionLabel");
        Objects.requireNonNull(interfaceHash, "interfaceHash must not be null");
    }

    /** Node id used in exports, {@code contractId@versionLabel}. */
    public String id() {
        return contractId + "@" + versionLabel;
    }

    /** True if this node is (contractId, versionLabel), ignoring the hash. */
    public boolean is(String otherContractId, String otherVersionLabel) {
        return contractId.equals(otherContractId) && versionLabel.equals(otherVersionLabel);
    }

    @Override
    public String toString() {
        return id();
    }

    private static void requireText(String value, String field) {
        Objects.requireNonNull(value, field + " must not be null");
        if (value.isBlank())
            throw new IllegalArgumentException(field + " must not be blank");
    }
}
