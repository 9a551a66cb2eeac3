package com.registry.depgraph.io;

import java.util.ArrayList;
import java.util.List;

/** Process-local {@link CommitLog}, mainly for tests and replication fan-out. */
public final class InMemoryCommitLog implements CommitLog {
    private final List<CommitRecord> records = new ArrayList<>();

    @Override
    public synchronized void append(CommitRecord record) {
        records.add(record);
    }

    @Override
    public synchronized List<CommitRecord> readAll() {
        return List.copyOf(records);
    }
}
