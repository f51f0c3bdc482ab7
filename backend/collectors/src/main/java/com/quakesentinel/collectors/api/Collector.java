package com.quakesentinel.collectors.api;

import com.quakesentinel.core.model.FeedType;

import java.util.concurrent.CompletableFuture;

/**
 * One poll of one feed. The returned future always completes normally; failures are reported through
 * the result and the event bus, never as an exceptional completion.
 */
public interface Collector {
    String name();

    FeedType feedType();

    CompletableFuture<CollectorResult> poll(CollectorContext ctx);
}
