package com.registry.depgraph.engine;

import com.registry.depgraph.Interfaces;
import com.registry.depgraph.api.*;
import com.registry.depgraph.cache.CacheKey;
import com.registry.depgraph.cache.QueryKind;
import com.registry.depgraph.cache.ResultCache;
import com.registry.depgraph.extract.InterfaceDescription;
import com.registry.depgraph.extract.ReferenceExtractor;
import com.registry.depgraph.io.CommitLog;
import com.registry.depgraph.io.CommitRecord;
import com.registry.depgraph.io.InMemoryCommitLog;
import org.junit.Before;
import org.junit.Test;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class PublicationCoordinatorTest {

    private GraphStore store;
    private ResultCache cache;
    private InMemoryCommitLog commitLog;
    private PublicationCoordinator coordinator;
    private final QueryEngine queries = new QueryEngine();

    @Before
    public void setUp() {
        store = new GraphStore();
        cache = new ResultCache();
        commitLog = new InMemoryCommitLog();
        coordinator = new PublicationCoordinator(new ReferenceExtractor(), store, cache, commitLog);
    }

    @Test
    public void testPublishDependentsImpactThenCycleRejected() {
        assertTrue(coordinator.publish("A", "1", Interfaces.plain("A")).isPublished());
        assertTrue(coordinator.publish("B", "1", Interfaces.clients("B", "A")).isPublished());

        GraphSnapshot s = store.current();
        ContractVersion a1 = s.version("A", "1");
        ContractVersion b1 = s.version("B", "1");
        assertEquals(List.of(new Dependent(b1, ReferenceKind.CLIENT)), queries.dependents(s, "A"));

        PublishResult c = coordinator.publish("C", "1", Interfaces.clients("C", "B"));
        assertTrue(c.isPublished());
        assertEquals(3, c.epoch());
        s = store.current();
        ContractVersion c1 = s.version("C", "1");
        assertEquals(List.of(new ImpactEntry(b1, 1), new ImpactEntry(c1, 2)), queries.impactAnalysis(s, a1));

        long cacheEpoch = cache.epoch();
        PublishResult rejected = coordinator.publish("A", "2", Interfaces.clients("A", "C"));

        assertFalse(rejected.isPublished());
        assertEquals(PublishResult.Status.CYCLE_DETECTED, rejected.status());
        assertEquals(3, rejected.epoch());
        CyclePath path = rejected.cyclePath().orElseThrow();
        assertEquals("A", path.origin().contractId());
        assertEquals("2", path.origin().versionLabel());
        assertEquals(List.of("A", "C", "B", "A"),
                path.nodes().stream().map(ContractVersion::contractId).toList());

        // Nothing changed.
        assertSame(s, store.current());
        assertEquals(cacheEpoch, cache.epoch());
        assertEquals(List.of(new Dependent(b1, ReferenceKind.CLIENT)), queries.dependents(store.current(), "A"));
        assertEquals(3, commitLog.readAll().size());
    }

    @Test
    public void testDuplicateVersionRejected() {
        assertTrue(coordinator.publish("X", "1.0", Interfaces.plain("X")).isPublished());
        GraphSnapshot before = store.current();

        PublishResult second = coordinator.publish("X", "1.0", Interfaces.plain("X"));

        assertEquals(PublishResult.Status.DUPLICATE_VERSION, second.status());
        assertTrue(second.error() instanceof DuplicateVersionException);
        assertSame(before, store.current());
        assertEquals(1, commitLog.readAll().size());
    }

    @Test
    public void testMalformedInterfaceRejected() {
        InterfaceDescription bad = Interfaces.clients("X", "ok", "");
        PublishResult result = coordinator.publish("X", "1", bad);

        assertEquals(PublishResult.Status.MALFORMED_INTERFACE, result.status());
        assertEquals(0, result.epoch());
        assertEquals(0, store.current().epoch());
        assertTrue(commitLog.readAll().isEmpty());
    }

    @Test
    public void testMissingVersionLabelIsMalformed() {
        assertEquals(PublishResult.Status.MALFORMED_INTERFACE,
                coordinator.publish("X", " ", Interfaces.plain("X")).status());
    }

    @Test
    public void testSuccessfulPublishInvalidatesCache() {
        CacheKey key = CacheKey.forContract(QueryKind.DEPENDENTS, "A");
        cache.put(key, List.of());
        assertTrue(cache.get(key).isPresent());

        coordinator.publish("A", "1", Interfaces.plain("A"));

        assertFalse(cache.get(key).isPresent());
    }

    @Test
    public void testPublishResultCarriesCommittedEdgesAndHash() {
        PublishResult r = coordinator.publish("dex", "1", Interfaces.clients("dex", "token", "token", "oracle"));
        assertEquals(2, r.edges().size());
        assertEquals("token", r.edges().get(0).toContractId());
        assertEquals(64, r.version().interfaceHash().length());
    }

    @Test
    public void testCommitLogFailureLeavesGraphUntouched() {
        CommitLog failing = new CommitLog() {
            @Override
            public void append(CommitRecord record) {
                throw new UncheckedIOException(new IOException("disk full"));
            }

            @Override
            public List<CommitRecord> readAll() {
                return List.of();
            }
        };
        PublicationCoordinator c = new PublicationCoordinator(new ReferenceExtractor(), store, cache, failing);
        try {
            c.publish("A", "1", Interfaces.plain("A"));
            fail("Expected UncheckedIOException");
        } catch (UncheckedIOException expected) {
            // fall through
        }
        assertEquals(0, store.current().epoch());
        assertEquals(0, cache.epoch());
    }

    @Test
    public void testReplayRebuildsIdenticalGraph() {
        coordinator.publish("A", "1", Interfaces.plain("A"));
        coordinator.publish("B", "1", Interfaces.clients("B", "A", "Z"));
        coordinator.publish("A", "2", Interfaces.imports("A", "Q"));
        GraphSnapshot original = store.current();

        GraphStore rebuilt = new GraphStore();
        new PublicationCoordinator(new ReferenceExtractor(), rebuilt, new ResultCache(), CommitLog.NONE)
                .replay(commitLog.readAll());

        assertEquals(original.epoch(), rebuilt.current().epoch());
        assertEquals(queries.exportGraph(original), queries.exportGraph(rebuilt.current()));
    }

    @Test(expected = IllegalStateException.class)
    public void testReplayRejectsEpochGap() {
        coordinator.publish("A", "1", Interfaces.plain("A"));
        coordinator.publish("B", "1", Interfaces.plain("B"));
        List<CommitRecord> records = new ArrayList<>(commitLog.readAll());
        records.remove(0);

        new PublicationCoordinator(new GraphStore(), new ResultCache()).replay(records);
    }

    @Test
    public void testConcurrentPublishesAreSerialized() throws Exception {
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<PublishResult>>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final int thread = t;
            futures.add(pool.submit(() -> {
                start.await();
                List<PublishResult> results = new ArrayList<>();
                for (int i = 0; i < perThread; i++) {
                    String id = "t" + thread + "-c" + i;
                    // Each contract depends on the previous one of the same thread.
                    InterfaceDescription d = i == 0 ? Interfaces.plain(id)
                            : Interfaces.clients(id, "t" + thread + "-c" + (i - 1));
                    results.add(coordinator.publish(id, "1", d));
                }
                return results;
            }));
        }
        start.countDown();
        List<Long> epochs = new ArrayList<>();
        for (Future<List<PublishResult>> f : futures)
            for (PublishResult r : f.get(30, TimeUnit.SECONDS)) {
                assertTrue(r.isPublished());
                epochs.add(r.epoch());
            }
        pool.shutdown();

        Collections.sort(epochs);
        for (int i = 0; i < epochs.size(); i++)
            assertEquals(i + 1, epochs.get(i).longValue());
        assertEquals(threads * perThread, store.current().nodeCount());
        assertEquals(threads * perThread, cache.epoch());
    }

    @Test
    public void testRandomPublishSequenceStaysAcyclic() {
        Random rnd = new Random(20261017L);
        int contracts = 12;
        int published = 0;
        int cycles = 0;
        for (int step = 0; step < 400; step++) {
            String id = "c" + rnd.nextInt(contracts);
            String[] targets = new String[rnd.nextInt(4)];
            for (int i = 0; i < targets.length; i++)
                targets[i] = "c" + rnd.nextInt(contracts);
            InterfaceDescription d = rnd.nextBoolean() ? Interfaces.clients(id, targets)
                    : Interfaces.imports(id, targets);

            GraphSnapshot before = store.current();
            GraphExport exportBefore = queries.exportGraph(before);
            Map<String, Set<String>> withNew = contractGraph(exportBefore);
            for (String t : targets)
                if (!t.equals(id))
                    withNew.computeIfAbsent(id, k -> new HashSet<>()).add(t);
            boolean closesCycle = hasCycle(withNew);

            PublishResult r = coordinator.publish(id, "v" + step, d);

            if (r.status() == PublishResult.Status.CYCLE_DETECTED) {
                cycles++;
                assertTrue("rejected without a cycle at step " + step, closesCycle);
                assertSame(before, store.current());
                assertEquals(exportBefore, queries.exportGraph(store.current()));
                CyclePath path = r.cyclePath().orElseThrow();
                assertEquals(id, path.origin().contractId());
            } else {
                assertEquals(PublishResult.Status.PUBLISHED, r.status());
                assertFalse("published a cycle at step " + step, closesCycle);
                published++;
                assertEquals(before.epoch() + 1, store.current().epoch());
            }
            assertFalse(hasCycle(contractGraph(queries.exportGraph(store.current()))));
        }
        assertTrue(published > 0);
        assertTrue(cycles > 0);
    }

    // Contract-level adjacency. A version edge reaches every version of its target,
    // so the version graph has a cycle exactly when this one does.
    private static Map<String, Set<String>> contractGraph(GraphExport export) {
        Map<String, String> contractOf = new HashMap<>();
        for (GraphExport.Node n : export.nodes())
            contractOf.put(n.id(), n.contractId());
        Map<String, Set<String>> adj = new HashMap<>();
        for (GraphExport.Edge e : export.edges())
            adj.computeIfAbsent(contractOf.get(e.from()), k -> new HashSet<>()).add(e.to());
        return adj;
    }

    private static boolean hasCycle(Map<String, Set<String>> adj) {
        Map<String, Integer> state = new HashMap<>(); // 1 = on stack, 2 = done
        for (String start : adj.keySet())
            if (visit(start, adj, state))
                return true;
        return false;
    }

    private static boolean visit(String node, Map<String, Set<String>> adj, Map<String, Integer> state) {
        Integer s = state.get(node);
        if (s != null)
            return s == 1;
        state.put(node, 1);
        for (String next : adj.getOrDefault(node, Set.of()))
            if (visit(next, adj, state))
                return true;
        state.put(node, 2);
        return false;
    }
}
