package com.registry.depgraph.api;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one publish. On success carries the new epoch, the committed
 * version and its edges; on failure the domain exception that rejected it. A
 * failed publish never changed any visible state.
 */
public record PublishResult(Status status, long epoch, ContractVersion version, List<DependencyEdge> edges,
        DependencyGraphException error) {

    public enum Status {
        PUBLISHED,
        MALFORMED_INTERFACE,
        DUPLICATE_VERSION,
        CYCLE_DETECTED
    }

    public PublishResult {
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static PublishResult published(long epoch, ContractVersion version, List<DependencyEdge> edges) {
        return new PublishResult(Status.PUBLISHED, epoch, version, edges, null);
    }

    /**
     * Failure result.
     *
     * @param epoch the epoch that stayed current
     */
    public static PublishResult rejected(long epoch, DependencyGraphException error) {
        Status status;
        if (error instanceof CycleDetectedException)
            status = Status.CYCLE_DETECTED;
        else if (error instanceof DuplicateVersionException)
            status = Status.DUPLICATE_VERSION;
        else if (error instanceof MalformedInterfaceException)
            status = Status.MALFORMED_INTERFACE;
        else
            throw new IllegalArgumentException("Not a publish failure: " + error.getClass().getSimpleName());
        return new PublishResult(status, epoch, null, List.of(), error);
    }

    public boolean isPublished() {
        return status == Status.PUBLISHED;
    }

    /** The cycle that rejected this publish, if that was the reason. */
    public Optional<CyclePath> cyclePath() {
        return error instanceof CycleDetectedException c ? Optional.of(c.path()) : Optional.empty();
    }
}
