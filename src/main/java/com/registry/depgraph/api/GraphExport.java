package com.registry.depgraph.api;

import java.util.List;

/**
 * Materialized node/edge view of one snapshot for visualization consumers.
 *
 * <p>
 * The shape is deliberately generic; adapting it to a charting library is the
 * consumer's job.
 */
public record GraphExport(long epoch, List<Node> nodes, List<Edge> edges) {

    public GraphExport {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /** {@code id} is {@code contractId@versionLabel}. */
    public record Node(String id, String contractId, String versionLabel) {
    }

    /** {@code from} is a node id, {@code to} a contract id. */
    public record Edge(String from, String to, String kind) {
    }
}
