package com.registry.depgraph.disruptor;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.registry.depgraph.api.PublishResult;
import com.registry.depgraph.engine.PublicationCoordinator;
import com.registry.depgraph.extract.InterfaceDescription;

import lombok.extern.log4j.Log4j2;

/**
 * Asynchronous front door for publishes, backed by an LMAX Disruptor ring
 * buffer with one consumer thread.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>Any number of producer threads call {@link #submit}, which claims a
 * slot, fills it, and publishes the sequence.</li>
 * <li>The {@link PublishEventHandler} on the consumer thread runs each publish
 * through the {@link PublicationCoordinator} in sequence order.</li>
 * <li>The returned future completes with the {@link PublishResult}.</li>
 * </ol>
 * Queries never go through the ring; they read snapshots directly.
 *
 * <p>
 * {@link #close()} applies every publish already in the ring. A future that is
 * still incomplete afterwards (a submit that raced with close) is completed
 * exceptionally, so no caller waits forever.
 */
@Log4j2
public final class PublicationPipeline implements AutoCloseable {
    private static final long START_TIMEOUT_SECONDS = 10;

    private final Disruptor<PublishEvent> disruptor;
    private final PublishEventHandler handler;
    private final Set<CompletableFuture<PublishResult>> pending = ConcurrentHashMap.newKeySet();
    private RingBuffer<PublishEvent> ringBuffer;
    private volatile boolean running;

    public PublicationPipeline(PublicationCoordinator coordinator, int ringBufferSize, String waitStrategy) {
        this.disruptor = new Disruptor<>(
                PublishEvent::new,
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                waitStrategy(waitStrategy));
        this.handler = new PublishEventHandler(coordinator);
        disruptor.handleEventsWith(handler);
    }

    public synchronized PublicationPipeline start() {
        if (running)
            throw new IllegalStateException("Publication pipeline already started");
        ringBuffer = disruptor.start();
        awaitConsumer();
        running = true;
        log.info("Publication pipeline started (ring buffer size {})", ringBuffer.getBufferSize());
        return this;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Enqueues a publish. Blocks only if the ring buffer is full.
     *
     * @throws IllegalStateException if the pipeline is not running
     */
    public CompletableFuture<PublishResult> submit(String contractId, String versionLabel,
            InterfaceDescription description) {
        if (!running)
            throw new IllegalStateException("Publication pipeline is not running");
        CompletableFuture<PublishResult> future = new CompletableFuture<>();
        pending.add(future);
        future.whenComplete((result, error) -> pending.remove(future));
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(contractId, versionLabel, description, future);
        } finally {
            ringBuffer.publish(sequence);
        }
        return future;
    }

    /** Drains pending publishes, then stops the consumer thread. */
    @Override
    public synchronized void close() {
        if (!running)
            return;
        running = false;
        disruptor.shutdown();
        int abandoned = 0;
        for (CompletableFuture<PublishResult> future : pending)
            if (future.completeExceptionally(new IllegalStateException("Publication pipeline closed")))
                abandoned++;
        if (abandoned > 0)
            log.warn("Publication pipeline stopped with {} unapplied submission(s)", abandoned);
        else
            log.info("Publication pipeline stopped");
    }

    private void awaitConsumer() {
        try {
            if (!handler.awaitStarted(START_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                disruptor.halt();
                throw new IllegalStateException("Publish consumer did not start within "
                        + START_TIMEOUT_SECONDS + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            disruptor.halt();
            throw new IllegalStateException("Interrupted while starting publication pipeline", e);
        }
    }

    static WaitStrategy waitStrategy(String name) {
        return switch (name == null ? "blocking" : name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> throw new IllegalArgumentException("Unknown wait strategy: " + name);
        };
    }
}
