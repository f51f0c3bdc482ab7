package com.quakesentinel.collectors.feed;

import com.quakesentinel.collectors.api.Collector;
import com.quakesentinel.collectors.api.CollectorContext;
import com.quakesentinel.collectors.api.CollectorResult;
import com.quakesentinel.collectors.api.FeedSource;
import com.quakesentinel.core.classify.EventNormalizer;
import com.quakesentinel.core.events.AlertRaised;
import com.quakesentinel.core.events.CollectorTickCompleted;
import com.quakesentinel.core.events.CollectorTickStarted;
import com.quakesentinel.core.model.FeedType;
import com.quakesentinel.core.model.NormalizedEvent;
import com.quakesentinel.core.model.RawEventRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls one feed: fetch the latest record, normalize it and hand it to the sink.
 */
public class FeedCollector implements Collector {
    private final FeedType feedType;
    private final FeedSource source;
    private final EventNormalizer normalizer;

    public FeedCollector(FeedType feedType, FeedSource source, EventNormalizer normalizer) {
        this.feedType = Objects.requireNonNull(feedType, "feedType is required");
        this.source = Objects.requireNonNull(source, "source is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    @Override
    public String name() {
        return feedType.collectorName();
    }

    @Override
    public FeedType feedType() {
        return feedType;
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        Instant tickStartedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorTickStarted(tickStartedAt, name()));

        return CompletableFuture.supplyAsync(() -> source.fetchLatest(feedType), ctx.executor())
                .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(latest -> deliver(latest, ctx))
                .handle((result, error) -> {
                    long durationMillis = Duration.between(tickStartedAt, ctx.clock().instant()).toMillis();
                    if (error != null) {
                        String message = failureMessage(error, ctx);
                        ctx.eventBus().publish(new AlertRaised(
                                ctx.clock().instant(),
                                AlertRaised.CATEGORY_COLLECTOR,
                                message,
                                Map.of("collector", name(), "feedType", feedType.name())
                        ));
                        ctx.eventBus().publish(new CollectorTickCompleted(
                                ctx.clock().instant(), name(), false, false, durationMillis));
                        return CollectorResult.failure(message, Map.of("durationMillis", durationMillis));
                    }
                    ctx.eventBus().publish(new CollectorTickCompleted(
                            ctx.clock().instant(), name(), true, result.updated(), durationMillis));
                    return result;
                });
    }

    private CollectorResult deliver(Optional<RawEventRecord> latest, CollectorContext ctx) {
        if (latest.isEmpty()) {
            return CollectorResult.noUpdate(feedType + " feed has no records", Map.of());
        }
        NormalizedEvent event = normalizer.normalize(latest.get());
        ctx.sink().deliver(event);

        Map<String, Object> stats = new HashMap<>();
        stats.put("occurredAt", event.occurredAt().toString());
        stats.put("severity", event.severity().name());
        stats.put("cancelled", event.cancelled());
        return CollectorResult.updated(feedType + " feed delivered latest record", stats);
    }

    private String failureMessage(Throwable error, CollectorContext ctx) {
        Throwable root = error;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        if (root instanceof TimeoutException) {
            return "Feed fetch for " + name() + " timed out after " + ctx.requestTimeout().toMillis() + "ms";
        }
        String detail = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        return "Feed fetch failed for " + name() + ": " + detail;
    }
}
