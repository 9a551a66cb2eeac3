package com.registry.depgraph.io;

import java.util.List;

/**
 * Append-only log of committed edge sets keyed by epoch. Replaying it in order
 * rebuilds the graph snapshot.
 */
public interface CommitLog extends AutoCloseable {

    /**
     * Durably appends one record. Called after validation and before the
     * snapshot swap; a failure here aborts the publish.
     */
    void append(CommitRecord record);

    /** All records in append order. */
    List<CommitRecord> readAll();

    @Override
    default void close() {
    }

    /** Log that records nothing; used when persistence is not configured. */
    CommitLog NONE = new CommitLog() {
        @Override
        public void append(CommitRecord record) {
        }

        @Override
        public List<CommitRecord> readAll() {
            return List.of();
        }
    };
}
