package com.registry.depgraph.engine;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.registry.depgraph.api.ContractVersion;
import com.registry.depgraph.api.CyclePath;
import com.registry.depgraph.api.CycleDetectedException;
import com.registry.depgraph.api.DependencyEdge;
import com.registry.depgraph.api.DuplicateVersionException;

/**
 * Owner of the single "current" {@link GraphSnapshot}.
 *
 * <p>
 * Readers call {@link #current()}, a plain volatile read of the last swapped-in
 * reference, and keep the snapshot for as long as their operation runs.
 * Writers build a validated candidate off to the side and swap it in with a
 * compare-and-set, so no reader ever observes a half-applied mutation.
 *
 * <p>
 * Commits are expected to be serialized by the caller (see
 * {@link PublicationCoordinator}). A commit that races another one fails with
 * {@link IllegalStateException} instead of overwriting it.
 */
public final class GraphStore {
    private static final Logger log = LogManager.getLogger(GraphStore.class);

    private final AtomicReference<GraphSnapshot> current;
    private final CycleDetector cycleDetector;

    public GraphStore() {
        this(GraphSnapshot.empty(), new CycleDetector());
    }

    public GraphStore(GraphSnapshot initial, CycleDetector cycleDetector) {
        this.current = new AtomicReference<>(initial);
        this.cycleDetector = cycleDetector;
    }

    /** Latest committed snapshot. Lock-free, O(1). */
    public GraphSnapshot current() {
        return current.get();
    }

    /**
     * Builds and validates the next snapshot without publishing it.
     *
     * @return a candidate one epoch after the current snapshot
     * @throws DuplicateVersionException if the version already exists
     * @throws CycleDetectedException    if the edges would close a cycle
     */
    public GraphSnapshot prepare(ContractVersion version, Collection<DependencyEdge> edges) {
        GraphSnapshot base = current.get();
        GraphSnapshot candidate = base.withVersion(version, edges);
        Optional<CyclePath> cycle = cycleDetector.detectCycle(candidate, version, candidate.edgesFrom(version));
        if (cycle.isPresent())
            throw new CycleDetectedException(cycle.get());
        return candidate;
    }

    /**
     * Swaps a prepared candidate in as current.
     *
     * @throws IllegalStateException if another commit happened since the
     *                               candidate was prepared
     */
    public GraphSnapshot publish(GraphSnapshot candidate) {
        GraphSnapshot expected = current.get();
        if (candidate.epoch() != expected.epoch() + 1 || !current.compareAndSet(expected, candidate))
            throw new IllegalStateException("Concurrent commit: candidate epoch " + candidate.epoch()
                    + " does not follow current epoch " + expected.epoch());
        log.debug("Snapshot swapped in: {}", candidate);
        return candidate;
    }

    /**
     * Prepares and publishes in one step. The current snapshot is untouched if
     * this throws.
     */
    public GraphSnapshot commitNewVersion(ContractVersion version, Collection<DependencyEdge> edges) {
        return publish(prepare(version, edges));
    }
}
