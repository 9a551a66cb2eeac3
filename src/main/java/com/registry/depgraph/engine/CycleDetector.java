package com.registry.depgraph.engine;

import java.util.*;

import com.registry.depgraph.api.ContractVersion;
import com.registry.depgraph.api.CyclePath;
import com.registry.depgraph.api.DependencyEdge;

/**
 * Publish-time cycle check over version nodes.
 *
 * <p>
 * The committed graph is acyclic, so any cycle in the candidate must pass
 * through the new version. For each new edge, in insertion order, the detector
 * runs a depth-first search from every committed version of the target
 * contract, following forward edges in insertion order, and stops as soon as
 * the new version is reached. A forward edge {@code v -> C} leads to every
 * version of {@code C} in publish order, so the new version is reachable from
 * any edge that targets its contract.
 *
 * <p>
 * The search is iterative with an explicit stack and a visited set shared by
 * all start nodes, so the whole check is O(V + E).
 */
public final class CycleDetector {

    /**
     * Checks whether the candidate contains a cycle through {@code newVersion}.
     *
     * @param candidate  snapshot that already contains {@code newVersion} and
     *                   {@code newEdges}
     * @param newVersion the version being published
     * @param newEdges   its edges, in insertion order
     * @return the first cycle found in deterministic traversal order, or empty
     */
    public Optional<CyclePath> detectCycle(GraphSnapshot candidate, ContractVersion newVersion,
            List<DependencyEdge> newEdges) {
        Set<ContractVersion> visited = new HashSet<>();
        for (DependencyEdge edge : newEdges) {
            for (ContractVersion start : candidate.versionsOf(edge.toContractId())) {
                if (start.equals(newVersion))
                    return Optional.of(new CyclePath(List.of(newVersion, newVersion)));
                if (!visited.add(start))
                    continue;
                List<ContractVersion> path = search(candidate, start, newVersion, visited);
                if (path != null) {
                    List<ContractVersion> cycle = new ArrayList<>(path.size() + 2);
                    cycle.add(newVersion);
                    cycle.addAll(path);
                    cycle.add(newVersion);
                    return Optional.of(new CyclePath(cycle));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * DFS from {@code start} (already marked visited). Returns the path from
     * start to the last node before {@code target}, or null if target is not
     * reachable.
     */
    private static List<ContractVersion> search(GraphSnapshot g, ContractVersion start, ContractVersion target,
            Set<ContractVersion> visited) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(start, g));
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            ContractVersion next = top.nextSuccessor(g);
            if (next == null) {
                stack.pop();
                continue;
            }
            if (next.equals(target)) {
                List<ContractVersion> path = new ArrayList<>(stack.size());
                Iterator<Frame> it = stack.descendingIterator();
                while (it.hasNext())
                    path.add(it.next().node);
                return path;
            }
            if (visited.add(next))
                stack.push(new Frame(next, g));
        }
        return null;
    }

    /** DFS frame: a node plus a cursor over its successors. */
    private static final class Frame {
        final ContractVersion node;
        final List<DependencyEdge> edges;
        int edgeIdx;
        List<ContractVersion> targets = List.of();
        int targetIdx;

        Frame(ContractVersion node, GraphSnapshot g) {
            this.node = node;
            this.edges = g.edgesFrom(node);
        }

        ContractVersion nextSuccessor(GraphSnapshot g) {
            while (targetIdx >= targets.size()) {
                if (edgeIdx >= edges.size())
                    return null;
                targets = g.versionsOf(edges.get(edgeIdx++).toContractId());
                targetIdx = 0;
            }
            return targets.get(targetIdx++);
        }
    }
}
