package com.registry.depgraph.util;

import java.util.List;

import com.registry.depgraph.api.ContractVersion;
import com.registry.depgraph.api.DependencyEdge;
import com.registry.depgraph.engine.GraphSnapshot;

/**
 * Diagnostic text rendering of a {@link GraphSnapshot}.
 *
 * <p>
 * <b>Usage:</b> intended for logs and debugging sessions. Allocates strings and
 * walks whole adjacency lists, so keep it off request paths.
 */
public final class GraphExplain {
    private final GraphSnapshot snapshot;

    public GraphExplain(GraphSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    /** Dumps one version: hash, edges with resolution state, direct dependents. */
    public String explainVersion(String contractId, String versionLabel) {
        ContractVersion v = snapshot.version(contractId, versionLabel);
        List<ContractVersion> siblings = snapshot.versionsOf(contractId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Version: ").append(v.id()).append('\n')
                .append("  Epoch: ").append(snapshot.epoch()).append('\n')
                .append("  Interface hash: ").append(v.interfaceHash()).append('\n')
                .append("  Latest: ").append(siblings.get(siblings.size() - 1).equals(v)).append('\n');

        List<DependencyEdge> out = snapshot.edgesFrom(v);
        sb.append("  Dependencies (").append(out.size()).append("):\n");
        for (DependencyEdge e : out) {
            sb.append("    ").append(e.kind().label()).append(' ').append(e.toContractId());
            if (!snapshot.isResolved(e.toContractId()))
                sb.append(" [unresolved]");
            sb.append('\n');
        }

        List<DependencyEdge> in = snapshot.edgesTo(contractId);
        sb.append("  Dependents (").append(in.size()).append("):\n");
        for (DependencyEdge e : in)
            sb.append("    ").append(e.from().id()).append(" (").append(e.kind().label()).append(")\n");
        return sb.toString();
    }

    /** Dumps every node with its outgoing edges, in publish order. */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph at epoch ").append(snapshot.epoch()).append(" (").append(snapshot.nodeCount())
                .append(" nodes, ").append(snapshot.edgeCount()).append(" edges):\n");
        List<ContractVersion> nodes = snapshot.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            ContractVersion v = nodes.get(i);
            sb.append("  [").append(i).append("] ").append(v.id());
            List<DependencyEdge> edges = snapshot.edgesFrom(v);
            if (!edges.isEmpty()) {
                sb.append(" -> ");
                for (int j = 0; j < edges.size(); j++) {
                    DependencyEdge e = edges.get(j);
                    sb.append(e.toContractId()).append('(').append(e.kind().label()).append(')');
                    if (j < edges.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
