package com.registry.depgraph.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.registry.depgraph.api.ContractReference;
import com.registry.depgraph.api.ContractVersion;
import com.registry.depgraph.api.CycleDetectedException;
import com.registry.depgraph.api.DependencyEdge;
import com.registry.depgraph.api.DependencyGraphException;
import com.registry.depgraph.api.DuplicateVersionException;
import com.registry.depgraph.api.MalformedInterfaceException;
import com.registry.depgraph.api.PublishResult;
import com.registry.depgraph.cache.ResultCache;
import com.registry.depgraph.extract.InterfaceDescription;
import com.registry.depgraph.extract.ReferenceExtractor;
import com.registry.depgraph.io.CommitLog;
import com.registry.depgraph.io.CommitRecord;
import com.registry.depgraph.io.InterfaceHasher;

/**
 * Runs one publish as a single serialized unit of work.
 *
 * <p>
 * Workflow, all under one fair lock:
 * <ol>
 * <li>Extract references from the interface description.</li>
 * <li>Build and validate the candidate snapshot (duplicate check, cycle
 * check).</li>
 * <li>Append the commit record to the {@link CommitLog}.</li>
 * <li>Swap the candidate in as current.</li>
 * <li>Advance the {@link ResultCache} epoch.</li>
 * </ol>
 * Domain failures in steps 1 and 2 come back as a rejected
 * {@link PublishResult}; nothing has been published at that point. A commit
 * log failure propagates as an exception, also before the swap.
 */
public final class PublicationCoordinator {
    private static final Logger log = LogManager.getLogger(PublicationCoordinator.class);

    private final ReentrantLock publishLock = new ReentrantLock(true);
    private final ReferenceExtractor extractor;
    private final GraphStore store;
    private final ResultCache cache;
    private final CommitLog commitLog;

    public PublicationCoordinator(ReferenceExtractor extractor, GraphStore store, ResultCache cache,
            CommitLog commitLog) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.store = Objects.requireNonNull(store, "store");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.commitLog = Objects.requireNonNull(commitLog, "commitLog");
    }

    public PublicationCoordinator(GraphStore store, ResultCache cache) {
        this(new ReferenceExtractor(), store, cache, CommitLog.NONE);
    }

    /**
     * Publishes a new contract version. Blocks while another publish is in
     * flight.
     */
    public PublishResult publish(String contractId, String versionLabel, InterfaceDescription description) {
        publishLock.lock();
        try {
            return doPublish(contractId, versionLabel, description);
        } finally {
            publishLock.unlock();
        }
    }

    private PublishResult doPublish(String contractId, String versionLabel, InterfaceDescription description) {
        long epochBefore = store.current().epoch();
        try {
            if (contractId == null || contractId.isBlank() || versionLabel == null || versionLabel.isBlank())
                throw new MalformedInterfaceException("contractId and versionLabel are required");
            Set<ContractReference> refs = extractor.extract(contractId, description);
            ContractVersion version = new ContractVersion(contractId, versionLabel,
                    InterfaceHasher.hash(description));
            List<DependencyEdge> edges = new ArrayList<>(refs.size());
            for (ContractReference ref : refs)
                edges.add(DependencyEdge.of(version, ref));

            GraphSnapshot candidate = store.prepare(version, edges);
            List<DependencyEdge> committed = candidate.edgesFrom(version);
            commitLog.append(CommitRecord.of(candidate.epoch(), version, committed));
            store.publish(candidate);
            cache.invalidateAll();

            log.info("Published {} at epoch {} with {} edge(s)", version.id(), candidate.epoch(), committed.size());
            return PublishResult.published(candidate.epoch(), version, committed);
        } catch (CycleDetectedException | DuplicateVersionException | MalformedInterfaceException e) {
            log.warn("Rejected {}@{}: {}", contractId, versionLabel, e.getMessage());
            return PublishResult.rejected(epochBefore, e);
        }
    }

    /**
     * Rebuilds the graph from previously committed records, in order. Used at
     * start-up before any publish; records are not re-appended.
     *
     * @throws IllegalStateException if epochs are not contiguous with the
     *                               current snapshot
     * @throws DependencyGraphException if a record no longer validates
     */
    public GraphSnapshot replay(List<CommitRecord> records) {
        publishLock.lock();
        try {
            for (CommitRecord record : records) {
                long expected = store.current().epoch() + 1;
                if (record.epoch() != expected)
                    throw new IllegalStateException("Commit log gap: expected epoch " + expected
                            + " but found " + record.epoch());
                store.commitNewVersion(record.version(), record.toEdges());
            }
            if (!records.isEmpty()) {
                cache.invalidateAll();
                log.info("Replayed {} commit(s), graph at epoch {}", records.size(), store.current().epoch());
            }
            return store.current();
        } finally {
            publishLock.unlock();
        }
    }
}
