package com.registry.depgraph.engine;

import java.util.*;

import com.registry.depgraph.api.ContractVersion;
import com.registry.depgraph.api.DependencyEdge;
import com.registry.depgraph.api.DuplicateVersionException;
import com.registry.depgraph.api.NotFoundException;

/**
 * Immutable adjacency structure of the whole graph at one committed epoch.
 *
 * <p>
 * Holds a forward index (version -> its edges) and a reverse index (contract id
 * -> edges pointing at it), both keeping insertion order. A snapshot is never
 * changed once built; {@link #withVersion} returns a new snapshot one epoch
 * later that shares every adjacency list the new version does not touch.
 *
 * <h3>Thread Safety</h3>
 * All fields are final and all collections unmodifiable, so a snapshot may be
 * read from any number of threads without coordination.
 */
public final class GraphSnapshot {
    private static final GraphSnapshot EMPTY = new GraphSnapshot(0L, List.of(), Map.of(), Map.of(), Map.of(), 0);

    private final long epoch;

    // All version nodes in publish order.
    private final List<ContractVersion> nodes;

    // contractId -> its versions in publish order. Last element is the latest.
    private final Map<String, List<ContractVersion>> versionsByContract;

    // Forward index: version -> edges it declares, insertion order.
    private final Map<ContractVersion, List<DependencyEdge>> forward;

    // Reverse index: target contractId -> edges pointing at it, insertion order.
    private final Map<String, List<DependencyEdge>> reverse;

    private final int edgeCount;

    private GraphSnapshot(long epoch, List<ContractVersion> nodes,
            Map<String, List<ContractVersion>> versionsByContract,
            Map<ContractVersion, List<DependencyEdge>> forward,
            Map<String, List<DependencyEdge>> reverse, int edgeCount) {
        this.epoch = epoch;
        this.nodes = nodes;
        this.versionsByContract = versionsByContract;
        this.forward = forward;
        this.reverse = reverse;
        this.edgeCount = edgeCount;
    }

    /** The snapshot at epoch 0: no nodes, no edges. */
    public static GraphSnapshot empty() {
        return EMPTY;
    }

    public long epoch() {
        return epoch;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    /** All version nodes in publish order. */
    public List<ContractVersion> nodes() {
        return nodes;
    }

    public boolean contains(ContractVersion version) {
        return forward.containsKey(version);
    }

    public Optional<ContractVersion> find(String contractId, String versionLabel) {
        for (ContractVersion v : versionsOf(contractId))
            if (v.versionLabel().equals(versionLabel))
                return Optional.of(v);
        return Optional.empty();
    }

    /**
     * Looks up a version node.
     *
     * @throws NotFoundException if the version is not in this snapshot.
     */
    public ContractVersion version(String contractId, String versionLabel) {
        return find(contractId, versionLabel)
                .orElseThrow(() -> NotFoundException.version(contractId, versionLabel));
    }

    /** Versions of a contract in publish order, empty if none were published. */
    public List<ContractVersion> versionsOf(String contractId) {
        return versionsByContract.getOrDefault(contractId, List.of());
    }

    /** Most recently published version of a contract. */
    public Optional<ContractVersion> latest(String contractId) {
        List<ContractVersion> versions = versionsOf(contractId);
        return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }

    /** True if at least one version of the contract has been published. */
    public boolean isResolved(String contractId) {
        return versionsByContract.containsKey(contractId);
    }

    /**
     * True if the contract has a version or is referenced by an edge (forward
     * reference to a not yet published contract).
     */
    public boolean isKnownContract(String contractId) {
        return versionsByContract.containsKey(contractId) || reverse.containsKey(contractId);
    }

    /** Contract ids with at least one version, in no particular order. */
    public Set<String> contractIds() {
        return versionsByContract.keySet();
    }

    /** Edges declared by a version, insertion order. Empty for unknown versions. */
    public List<DependencyEdge> edgesFrom(ContractVersion version) {
        return forward.getOrDefault(version, List.of());
    }

    /** Edges pointing at a contract, insertion order. */
    public List<DependencyEdge> edgesTo(String contractId) {
        return reverse.getOrDefault(contractId, List.of());
    }

    /**
     * Builds the candidate snapshot for the next epoch with one new version and
     * its edges. Duplicate (from, to, kind) edges collapse to one.
     *
     * <p>
     * Only the lists the new version touches are reallocated: its own forward
     * list, its contract's version list, and the reverse list of each target.
     * Every other list is shared with this snapshot.
     *
     * @throws DuplicateVersionException if (contractId, versionLabel) already
     *                                   exists.
     * @throws IllegalArgumentException  if an edge does not start at
     *                                   {@code version}.
     */
    public GraphSnapshot withVersion(ContractVersion version, Collection<DependencyEdge> edges) {
        Objects.requireNonNull(version, "version must not be null");
        if (find(version.contractId(), version.versionLabel()).isPresent())
            throw new DuplicateVersionException(version.contractId(), version.versionLabel());

        Set<DependencyEdge> unique = new LinkedHashSet<>();
        for (DependencyEdge e : edges) {
            if (!e.from().equals(version))
                throw new IllegalArgumentException("Edge " + e + " does not originate at " + version.id());
            unique.add(e);
        }
        List<DependencyEdge> newEdges = List.copyOf(unique);

        List<ContractVersion> nextNodes = new ArrayList<>(nodes.size() + 1);
        nextNodes.addAll(nodes);
        nextNodes.add(version);

        Map<String, List<ContractVersion>> nextVersions = new HashMap<>(versionsByContract);
        nextVersions.put(version.contractId(), append(versionsOf(version.contractId()), version));

        Map<ContractVersion, List<DependencyEdge>> nextForward = new HashMap<>(forward);
        nextForward.put(version, newEdges);

        Map<String, List<DependencyEdge>> nextReverse = new HashMap<>(reverse);
        for (DependencyEdge e : newEdges)
            nextReverse.put(e.toContractId(), append(nextReverse.getOrDefault(e.toContractId(), List.of()), e));

        return new GraphSnapshot(epoch + 1,
                Collections.unmodifiableList(nextNodes),
                Collections.unmodifiableMap(nextVersions),
                Collections.unmodifiableMap(nextForward),
                Collections.unmodifiableMap(nextReverse),
                edgeCount + newEdges.size());
    }

    private static <T> List<T> append(List<T> list, T item) {
        List<T> copy = new ArrayList<>(list.size() + 1);
        copy.addAll(list);
        copy.add(item);
        return Collections.unmodifiableList(copy);
    }

    @Override
    public String toString() {
        return "GraphSnapshot[epoch=" + epoch + ", nodes=" + nodes.size() + ", edges=" + edgeCount + "]";
    }
}
