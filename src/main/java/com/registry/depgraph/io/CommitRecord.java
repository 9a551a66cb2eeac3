package com.registry.depgraph.io;

import java.util.ArrayList;
import java.util.List;

import com.registry.depgraph.api.ContractVersion;
import com.registry.depgraph.api.DependencyEdge;
import com.registry.depgraph.api.ReferenceKind;

/**
 * One committed publish as it is written to a {@link CommitLog}: the epoch it
 * produced, the version node and its edge set.
 */
public record CommitRecord(long epoch, String contractId, String versionLabel, String interfaceHash,
        List<EdgeRecord> edges) {

    public CommitRecord {
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /** Edge as stored: target contract and kind label. */
    public record EdgeRecord(String to, String kind) {
    }

    public static CommitRecord of(long epoch, ContractVersion version, List<DependencyEdge> edges) {
        List<EdgeRecord> out = new ArrayList<>(edges.size());
        for (DependencyEdge e : edges)
            out.add(new EdgeRecord(e.toContractId(), e.kind().label()));
        return new CommitRecord(epoch, version.contractId(), version.versionLabel(), version.interfaceHash(), out);
    }

    public ContractVersion version() {
        return new ContractVersion(contractId, versionLabel, interfaceHash);
    }

    /** Rebuilds the edges of {@link #version()} in stored order. */
    public List<DependencyEdge> toEdges() {
        ContractVersion from = version();
        List<DependencyEdge> out = new ArrayList<>(edges.size());
        for (EdgeRecord e : edges)
            out.add(new DependencyEdge(from, e.to(), ReferenceKind.fromLabel(e.kind())));
        return out;
    }
}
