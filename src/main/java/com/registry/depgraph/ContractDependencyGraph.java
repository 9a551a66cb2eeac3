package com.registry.depgraph;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.registry.depgraph.api.ContractVersion;
import com.registry.depgraph.api.DependencyEdge;
import com.registry.depgraph.api.DependencyTreeNode;
import com.registry.depgraph.api.Dependent;
import com.registry.depgraph.api.GraphExport;
import com.registry.depgraph.api.ImpactEntry;
import com.registry.depgraph.api.PublishResult;
import com.registry.depgraph.cache.CacheKey;
import com.registry.depgraph.cache.CacheStats;
import com.registry.depgraph.cache.QueryKind;
import com.registry.depgraph.cache.ResultCache;
import com.registry.depgraph.disruptor.PublicationPipeline;
import com.registry.depgraph.engine.GraphSnapshot;
import com.registry.depgraph.engine.GraphStore;
import com.registry.depgraph.engine.PublicationCoordinator;
import com.registry.depgraph.engine.QueryEngine;
import com.registry.depgraph.extract.InterfaceDescription;
import com.registry.depgraph.extract.ReferenceExtractor;
import com.registry.depgraph.io.CommitLog;
import com.registry.depgraph.io.EngineConfig;
import com.registry.depgraph.io.JsonLinesCommitLog;
import com.registry.depgraph.util.GraphExplain;

/**
 * Entry point of the dependency graph engine.
 *
 * <p>
 * Wires the {@link ReferenceExtractor}, {@link GraphStore},
 * {@link ResultCache}, {@link PublicationCoordinator}, the optional
 * {@link CommitLog} and the asynchronous {@link PublicationPipeline}, and
 * exposes:
 * <ul>
 * <li>{@link #publish} / {@link #publishAsync} for the publication flow</li>
 * <li>cached reads over the latest snapshot ({@link #dependencies},
 * {@link #dependents}, {@link #impactAnalysis}, {@link #exportGraph},
 * {@link #dependencyTree}, {@link #unresolvedReferences})</li>
 * <li>{@link #snapshot()} plus {@link #queries()} for callers that need
 * several reads against one consistent epoch</li>
 * </ul>
 *
 * <p>
 * A version label of {@code null} in any read means "latest version of the
 * contract".
 */
public final class ContractDependencyGraph implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ContractDependencyGraph.class);

    private final EngineConfig config;
    private final GraphStore store;
    private final ResultCache cache;
    private final QueryEngine queries;
    private final CommitLog commitLog;
    private final PublicationCoordinator coordinator;
    private final PublicationPipeline pipeline;

    public ContractDependencyGraph() {
        this(EngineConfig.defaults());
    }

    public ContractDependencyGraph(EngineConfig config) {
        this(config, config.getCommitLogPath() == null ? CommitLog.NONE
                : new JsonLinesCommitLog(Path.of(config.getCommitLogPath())));
    }

    /**
     * Creates the engine and replays {@code commitLog} into it before accepting
     * publishes.
     */
    public ContractDependencyGraph(EngineConfig config, CommitLog commitLog) {
        this.config = config.validate();
        this.store = new GraphStore();
        this.cache = new ResultCache(config.getCacheMaxEntries());
        this.queries = new QueryEngine();
        this.commitLog = commitLog;
        this.coordinator = new PublicationCoordinator(new ReferenceExtractor(), store, cache, commitLog);
        coordinator.replay(commitLog.readAll());
        this.pipeline = new PublicationPipeline(coordinator, config.getRingBufferSize(), config.getWaitStrategy())
                .start();
        log.info("Dependency graph ready at epoch {} (cache {})", store.current().epoch(),
                config.isCacheEnabled() ? "enabled" : "disabled");
    }

    // ---- Publication ----

    /** Publishes synchronously on the calling thread. */
    public PublishResult publish(String contractId, String versionLabel, InterfaceDescription description) {
        return coordinator.publish(contractId, versionLabel, description);
    }

    /** Publishes through the ring buffer; the future completes once applied. */
    public CompletableFuture<PublishResult> publishAsync(String contractId, String versionLabel,
            InterfaceDescription description) {
        return pipeline.submit(contractId, versionLabel, description);
    }

    // ---- Snapshot access ----

    /** Latest committed snapshot; hold on to it for multi-read consistency. */
    public GraphSnapshot snapshot() {
        return store.current();
    }

    public QueryEngine queries() {
        return queries;
    }

    public long epoch() {
        return store.current().epoch();
    }

    // ---- Cached reads over the latest snapshot ----

    public List<DependencyEdge> dependencies(String contractId, String versionLabel) {
        return cachedForVersion(QueryKind.DEPENDENCIES, contractId, versionLabel, EdgeList.class,
                (s, v) -> new EdgeList(queries.dependencies(s, v))).edges();
    }

    /** Dependents of a contract (all versions share them). */
    public List<Dependent> dependents(String contractId) {
        return cached(CacheKey.forContract(QueryKind.DEPENDENTS, contractId), DependentList.class,
                s -> new DependentList(queries.dependents(s, contractId))).dependents();
    }

    /** Dependents of one version; validates that the version exists. */
    public List<Dependent> dependents(String contractId, String versionLabel) {
        return cachedForVersion(QueryKind.DEPENDENTS, contractId, versionLabel, DependentList.class,
                (s, v) -> new DependentList(queries.dependents(s, v))).dependents();
    }

    public List<ImpactEntry> impactAnalysis(String contractId, String versionLabel) {
        return cachedForVersion(QueryKind.IMPACT, contractId, versionLabel, ImpactList.class,
                (s, v) -> new ImpactList(queries.impactAnalysis(s, v))).entries();
    }

    public DependencyTreeNode dependencyTree(String contractId, String versionLabel) {
        return cachedForVersion(QueryKind.DEPENDENCY_TREE, contractId, versionLabel, DependencyTreeNode.class,
                (s, v) -> queries.dependencyTree(s, v, config.getMaxTreeDepth()));
    }

    public List<DependencyEdge> unresolvedReferences() {
        return cached(CacheKey.forGraph(QueryKind.UNRESOLVED), EdgeList.class,
                s -> new EdgeList(queries.unresolvedReferences(s))).edges();
    }

    public GraphExport exportGraph() {
        return cached(CacheKey.forGraph(QueryKind.EXPORT), GraphExport.class, queries::exportGraph);
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    /** Text dump of one version for logs. */
    public String explain(String contractId, String versionLabel) {
        GraphSnapshot s = store.current();
        ContractVersion v = queries.resolve(s, contractId, versionLabel);
        return new GraphExplain(s).explainVersion(v.contractId(), v.versionLabel());
    }

    /** Drains the publication pipeline and closes the commit log. */
    @Override
    public void close() {
        pipeline.close();
        commitLog.close();
    }

    // ---- Internals ----

    @FunctionalInterface
    private interface VersionQuery<T> {
        T apply(GraphSnapshot snapshot, ContractVersion version);
    }

    // Cached payload types for list-valued queries.
    private record EdgeList(List<DependencyEdge> edges) {
    }

    private record DependentList(List<Dependent> dependents) {
    }

    private record ImpactList(List<ImpactEntry> entries) {
    }

    private <T> T cachedForVersion(QueryKind kind, String contractId, String versionLabel, Class<T> type,
            VersionQuery<T> query) {
        // The cache epoch must be read before the snapshot; see ResultCache.
        long epoch = cache.epoch();
        GraphSnapshot s = store.current();
        ContractVersion v = queries.resolve(s, contractId, versionLabel);
        return lookupOrCompute(CacheKey.forVersion(kind, v), type, epoch, s, snap -> query.apply(snap, v));
    }

    private <T> T cached(CacheKey key, Class<T> type, Function<GraphSnapshot, T> query) {
        long epoch = cache.epoch();
        return lookupOrCompute(key, type, epoch, store.current(), query);
    }

    private <T> T lookupOrCompute(CacheKey key, Class<T> type, long epoch, GraphSnapshot s,
            Function<GraphSnapshot, T> query) {
        if (!config.isCacheEnabled())
            return query.apply(s);
        return cache.get(key, type).orElseGet(() -> {
            T result = query.apply(s);
            cache.put(key, epoch, result);
            return result;
        });
    }
}
