package com.registry.depgraph.api;

import java.util.Objects;

/** One declared reference extracted from an interface description. */
public record ContractReference(String targetContractId, ReferenceKind kind) {
    public ContractReference {
        Objects.requireNonNull(targetContractId, "targetContractId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }
}
