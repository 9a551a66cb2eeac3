package com.registry.depgraph.engine;

import java.util.*;

import com.registry.depgraph.api.ContractVersion;
import com.registry.depgraph.api.DependencyEdge;
import com.registry.depgraph.api.DependencyTreeNode;
import com.registry.depgraph.api.Dependent;
import com.registry.depgraph.api.GraphExport;
import com.registry.depgraph.api.ImpactEntry;
import com.registry.depgraph.api.NotFoundException;
import com.registry.depgraph.api.ReferenceKind;

/**
 * Read operations over one explicit {@link GraphSnapshot}.
 *
 * <p>
 * Every method takes the snapshot as an argument and never touches the store,
 * so a query observes exactly one epoch even if publishes commit while it runs.
 * Results are unmodifiable lists of plain records with deterministic order:
 * repeated calls against the same snapshot return equal results.
 *
 * <p>
 * The only failure mode is {@link NotFoundException} for an unknown subject.
 */
public final class QueryEngine {

    /**
     * Resolves a version node. A null label means the latest published version
     * of the contract.
     */
    public ContractVersion resolve(GraphSnapshot snapshot, String contractId, String versionLabel) {
        if (versionLabel == null)
            return snapshot.latest(contractId).orElseThrow(() -> NotFoundException.contract(contractId));
        return snapshot.version(contractId, versionLabel);
    }

    /** Direct forward edges of a version, ordered by (kind, target contract). */
    public List<DependencyEdge> dependencies(GraphSnapshot snapshot, ContractVersion version) {
        requireVersion(snapshot, version);
        List<DependencyEdge> edges = new ArrayList<>(snapshot.edgesFrom(version));
        edges.sort(DependencyEdge.BY_KIND_THEN_TARGET);
        return Collections.unmodifiableList(edges);
    }

    /**
     * Direct reverse edges of a contract, ordered by (contractId, versionLabel,
     * kind) of the dependent.
     *
     * @throws NotFoundException if the contract has neither a version nor an
     *                           incoming reference
     */
    public List<Dependent> dependents(GraphSnapshot snapshot, String contractId) {
        if (!snapshot.isKnownContract(contractId))
            throw NotFoundException.contract(contractId);
        List<DependencyEdge> incoming = snapshot.edgesTo(contractId);
        List<Dependent> result = new ArrayList<>(incoming.size());
        for (DependencyEdge e : incoming)
            result.add(new Dependent(e.from(), e.kind()));
        result.sort(Dependent.ORDER);
        return Collections.unmodifiableList(result);
    }

    /**
     * Direct reverse edges of a version. Edges target contracts, so these are
     * the dependents of the version's contract.
     */
    public List<Dependent> dependents(GraphSnapshot snapshot, ContractVersion version) {
        requireVersion(snapshot, version);
        return dependents(snapshot, version.contractId());
    }

    /**
     * Transitive reverse closure of a version.
     *
     * <p>
     * Breadth-first over reverse edges, so each reachable version appears once
     * at its minimum hop count. Ordered by depth, then (contractId,
     * versionLabel). The origin itself is not included.
     */
    public List<ImpactEntry> impactAnalysis(GraphSnapshot snapshot, ContractVersion origin) {
        requireVersion(snapshot, origin);
        Set<ContractVersion> visited = new HashSet<>();
        visited.add(origin);
        List<ImpactEntry> result = new ArrayList<>();

        ArrayDeque<ContractVersion> frontier = new ArrayDeque<>();
        frontier.add(origin);
        int depth = 0;
        while (!frontier.isEmpty()) {
            depth++;
            // Process one full level so depth stays exact.
            int levelSize = frontier.size();
            for (int i = 0; i < levelSize; i++) {
                ContractVersion node = frontier.poll();
                for (DependencyEdge e : snapshot.edgesTo(node.contractId())) {
                    if (visited.add(e.from())) {
                        result.add(new ImpactEntry(e.from(), depth));
                        frontier.add(e.from());
                    }
                }
            }
        }
        result.sort(ImpactEntry.ORDER);
        return Collections.unmodifiableList(result);
    }

    /**
     * Forward dependency tree rooted at a version. Each target contract resolves
     * to its latest version in the snapshot; targets without a version are
     * unresolved leaves. Below {@code maxDepth} levels the walk stops and marks
     * the node truncated.
     */
    public DependencyTreeNode dependencyTree(GraphSnapshot snapshot, ContractVersion root, int maxDepth) {
        requireVersion(snapshot, root);
        if (maxDepth < 0)
            throw new IllegalArgumentException("maxDepth must be >= 0: " + maxDepth);
        return expand(snapshot, root, null, 0, maxDepth);
    }

    private DependencyTreeNode expand(GraphSnapshot snapshot, ContractVersion node,
            ReferenceKind kind, int depth, int maxDepth) {
        List<DependencyEdge> edges = snapshot.edgesFrom(node);
        if (depth >= maxDepth)
            return new DependencyTreeNode(node.contractId(), node.versionLabel(), kind, true, !edges.isEmpty(),
                    List.of());
        List<DependencyEdge> ordered = new ArrayList<>(edges);
        ordered.sort(DependencyEdge.BY_KIND_THEN_TARGET);
        List<DependencyTreeNode> children = new ArrayList<>(ordered.size());
        for (DependencyEdge e : ordered) {
            Optional<ContractVersion> target = snapshot.latest(e.toContractId());
            if (target.isPresent())
                children.add(expand(snapshot, target.get(), e.kind(), depth + 1, maxDepth));
            else
                children.add(DependencyTreeNode.unresolved(e.toContractId(), e.kind()));
        }
        return new DependencyTreeNode(node.contractId(), node.versionLabel(), kind, true, false, children);
    }

    /** Edges whose target contract has no published version, insertion order. */
    public List<DependencyEdge> unresolvedReferences(GraphSnapshot snapshot) {
        List<DependencyEdge> result = new ArrayList<>();
        for (ContractVersion v : snapshot.nodes())
            for (DependencyEdge e : snapshot.edgesFrom(v))
                if (!snapshot.isResolved(e.toContractId()))
                    result.add(e);
        return Collections.unmodifiableList(result);
    }

    /**
     * Full node/edge view. Nodes in publish order, edges in insertion order, so
     * exporting the same snapshot twice yields identical output.
     */
    public GraphExport exportGraph(GraphSnapshot snapshot) {
        List<GraphExport.Node> nodes = new ArrayList<>(snapshot.nodeCount());
        List<GraphExport.Edge> edges = new ArrayList<>(snapshot.edgeCount());
        for (ContractVersion v : snapshot.nodes()) {
            nodes.add(new GraphExport.Node(v.id(), v.contractId(), v.versionLabel()));
            for (DependencyEdge e : snapshot.edgesFrom(v))
                edges.add(new GraphExport.Edge(v.id(), e.toContractId(), e.kind().label()));
        }
        return new GraphExport(snapshot.epoch(), nodes, edges);
    }

    private static void requireVersion(GraphSnapshot snapshot, ContractVersion version) {
        Objects.requireNonNull(version, "version must not be null");
        if (!snapshot.contains(version))
            throw NotFoundException.version(version.contractId(), version.versionLabel());
    }
}
