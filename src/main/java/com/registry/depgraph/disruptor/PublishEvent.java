package com.registry.depgraph.disruptor;

import java.util.concurrent.CompletableFuture;

import com.registry.depgraph.api.PublishResult;
import com.registry.depgraph.extract.InterfaceDescription;

/**
 * Mutable ring-buffer slot carrying one publish request.
 *
 * <p>
 * <b>Flyweight Pattern:</b> slots are pre-allocated when the ring buffer is
 * built and reused for the lifetime of the pipeline. The consumer
 * {@link #clear()}s a slot after handling it so the ring does not pin
 * descriptions or futures.
 */
public final class PublishEvent {
    private String contractId;
    private String versionLabel;
    private InterfaceDescription description;
    private CompletableFuture<PublishResult> result;

    public void set(String contractId, String versionLabel, InterfaceDescription description,
            CompletableFuture<PublishResult> result) {
        this.contractId = contractId;
        this.versionLabel = versionLabel;
        this.description = description;
        this.result = result;
    }

    public String contractId() {
        return contractId;
    }

    public String versionLabel() {
        return versionLabel;
    }

    public InterfaceDescription description() {
        return description;
    }

    public CompletableFuture<PublishResult> result() {
        return result;
    }

    public void clear() {
        contractId = null;
        versionLabel = null;
        description = null;
        result = null;
    }
}
