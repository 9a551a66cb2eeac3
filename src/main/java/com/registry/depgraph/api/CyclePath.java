package com.registry.depgraph.api;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Concrete cycle found at publish time. Starts at the version being published
 * and ends with the same version, e.g. {@code A@2 -> C@1 -> B@1 -> A@2}.
 */
public record CyclePath(List<ContractVersion> nodes) {
    public CyclePath {
        if (nodes == null || nodes.size() < 2)
            throw new IllegalArgumentException("A cycle path needs at least two nodes");
        nodes = List.copyOf(nodes);
    }

    public ContractVersion origin() {
        return nodes.get(0);
    }

    /** Number of edges in the cycle. */
    public int length() {
        return nodes.size() - 1;
    }

    @Override
    public String toString() {
        return nodes.stream().map(ContractVersion::id).collect(Collectors.joining(" -> "));
    }
}
