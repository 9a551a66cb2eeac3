package com.registry.depgraph.api;

import java.util.Comparator;

/** A direct reverse edge: {@code fromVersion} references the queried contract. */
public record Dependent(ContractVersion fromVersion, ReferenceKind kind) {

    public static final Comparator<Dependent> ORDER = Comparator
            .comparing(Dependent::fromVersion, ContractVersion.BY_ID)
            .thenComparing(Dependent::kind);
}
