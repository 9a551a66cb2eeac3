package com.registry.depgraph.util;

import com.registry.depgraph.Interfaces;
import com.registry.depgraph.api.NotFoundException;
import com.registry.depgraph.cache.ResultCache;
import com.registry.depgraph.engine.GraphStore;
import com.registry.depgraph.engine.PublicationCoordinator;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private GraphExplain explain;

    @Before
    public void setUp() {
        GraphStore store = new GraphStore();
        PublicationCoordinator coordinator = new PublicationCoordinator(store, new ResultCache());
        coordinator.publish("token", "1", Interfaces.plain("token"));
        coordinator.publish("token", "2", Interfaces.plain("token"));
        coordinator.publish("dex", "1", Interfaces.clients("dex", "token", "oracle"));
        explain = new GraphExplain(store.current());
    }

    @Test
    public void testExplainVersion() {
        String text = explain.explainVersion("dex", "1");

        assertTrue(text.startsWith("Version: dex@1\n"));
        assertTrue(text.contains("  Epoch: 3\n"));
        assertTrue(text.contains("  Latest: true\n"));
        assertTrue(text.contains("    client token\n"));
        assertTrue(text.contains("    client oracle [unresolved]\n"));
        assertTrue(text.contains("  Dependents (0):\n"));
    }

    @Test
    public void testExplainOlderVersionListsContractDependents() {
        String text = explain.explainVersion("token", "1");

        assertTrue(text.contains("  Latest: false\n"));
        assertTrue(text.contains("    dex@1 (client)\n"));
    }

    @Test(expected = NotFoundException.class)
    public void testExplainUnknownVersion() {
        explain.explainVersion("token", "9");
    }

    @Test
    public void testDumpTopology() {
        String dump = explain.dumpTopology();

        assertTrue(dump.startsWith("Graph at epoch 3 (3 nodes, 2 edges):\n"));
        assertTrue(dump.contains("  [0] token@1\n"));
        assertTrue(dump.contains("  [2] dex@1 -> token(client), oracle(client)\n"));
    }
}
