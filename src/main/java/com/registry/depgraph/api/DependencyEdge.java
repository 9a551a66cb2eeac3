package com.registry.depgraph.api;

import java.util.Comparator;
import java.util.Objects;

/**
 * Directed reference from a dependent version to a depended-upon contract.
 *
 * <p>
 * The target is a contract, not a version: the edge reaches every committed
 * version of {@code toContractId}. Record equality gives the (from, to, kind)
 * collapse rule for duplicates.
 */
public record DependencyEdge(ContractVersion from, String toContractId, ReferenceKind kind) {

    /** Ordering used by {@code Dependencies}: kind first, then target. */
    public static final Comparator<DependencyEdge> BY_KIND_THEN_TARGET = Comparator
            .comparing(DependencyEdge::kind)
            .thenComparing(DependencyEdge::toContractId);

    public DependencyEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(toContractId, "toContractId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /** Binds an extracted reference to the version that declared it. */
    public static DependencyEdge of(ContractVersion from, ContractReference ref) {
        return new DependencyEdge(from, ref.targetContractId(), ref.kind());
    }

    @Override
    public String toString() {
        return from.id() + " -[" + kind.label() + "]-> " + toContractId;
    }
}
