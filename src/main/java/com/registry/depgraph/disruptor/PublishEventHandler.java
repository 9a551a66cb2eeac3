package com.registry.depgraph.disruptor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.LifecycleAware;
import com.registry.depgraph.api.PublishResult;
import com.registry.depgraph.engine.PublicationCoordinator;

/**
 * Disruptor consumer that feeds ring-buffer slots to the
 * {@link PublicationCoordinator}.
 *
 * <p>
 * Runs on the pipeline's single consumer thread, so publishes submitted
 * through the ring buffer are applied strictly in sequence order. Any failure
 * is reported through the slot's future and never rethrown, which keeps the
 * consumer thread alive for the next event.
 *
 * <p>
 * The Disruptor only drains events on shutdown for processors that are already
 * running, so {@link PublicationPipeline#start()} waits for {@link #onStart()}
 * before accepting submissions.
 */
public final class PublishEventHandler implements EventHandler<PublishEvent>, LifecycleAware {
    private static final Logger log = LogManager.getLogger(PublishEventHandler.class);

    private final PublicationCoordinator coordinator;
    private final CountDownLatch started = new CountDownLatch(1);

    public PublishEventHandler(PublicationCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void onEvent(PublishEvent event, long sequence, boolean endOfBatch) {
        try {
            PublishResult result = coordinator.publish(event.contractId(), event.versionLabel(),
                    event.description());
            event.result().complete(result);
        } catch (Exception e) {
            log.error("Publish of {}@{} failed at sequence {}: {}", event.contractId(), event.versionLabel(),
                    sequence, e.getMessage(), e);
            event.result().completeExceptionally(e);
        } finally {
            event.clear();
        }
    }

    @Override
    public void onStart() {
        started.countDown();
        log.debug("Publish consumer thread started");
    }

    @Override
    public void onShutdown() {
        log.debug("Publish consumer thread stopped");
    }

    /** Waits until the consumer thread is running. */
    boolean awaitStarted(long timeout, TimeUnit unit) throws InterruptedException {
        return started.await(timeout, unit);
    }
}
