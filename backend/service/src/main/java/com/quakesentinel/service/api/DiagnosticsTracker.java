package com.quakesentinel.service.api;

import com.quakesentinel.core.bus.EventBus;
import com.quakesentinel.core.events.AlertRaised;
import com.quakesentinel.core.events.CollectorTickCompleted;
import com.quakesentinel.core.events.CollectorTickStarted;
import com.quakesentinel.core.events.Event;
import com.quakesentinel.core.model.FeedType;
import com.quakesentinel.service.store.EventCodec;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntSupplier;
import java.util.logging.Logger;

public final class DiagnosticsTracker {
    private static final Logger LOGGER = Logger.getLogger(DiagnosticsTracker.class.getName());
    static final int NO_SIGNAL_AFTER_FAILURES = 3;

    private final Clock clock;
    private final IntSupplier sseClientCountSupplier;
    private final LongAdder eventsEmittedTotal = new LongAdder();
    private final LongAdder alertsAnnouncedTotal = new LongAdder();
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final ConcurrentHashMap<String, FeedStatus> feedStatuses = new ConcurrentHashMap<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock, IntSupplier sseClientCountSupplier) {
        this.clock = clock;
        this.sseClientCountSupplier = sseClientCountSupplier;
        for (FeedType feedType : FeedType.values()) {
            feedStatuses.put(feedType.collectorName(), FeedStatus.empty());
        }
        EventCodec.subscribeAll(eventBus, this::onAnyEvent);
        eventBus.subscribe(CollectorTickStarted.class, this::onTickStarted);
        eventBus.subscribe(CollectorTickCompleted.class, this::onTickCompleted);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("sseClientsConnected", sseClientCountSupplier.getAsInt());
        metrics.put("eventsEmittedTotal", eventsEmittedTotal.longValue());
        metrics.put("alertsAnnouncedTotal", alertsAnnouncedTotal.longValue());
        metrics.put("recentEventsPerMinute", recentEventsPerMinute());
        metrics.put("feeds", feedsSnapshot());
        return metrics;
    }

    public Map<String, Object> feedsSnapshot() {
        Map<String, Object> feeds = new TreeMap<>();
        for (Map.Entry<String, FeedStatus> entry : feedStatuses.entrySet()) {
            feeds.put(entry.getKey(), entry.getValue().toMap());
        }
        return feeds;
    }

    public FeedSignal signal(FeedType feedType) {
        return feedStatuses.getOrDefault(feedType.collectorName(), FeedStatus.empty()).signal();
    }

    private void onAnyEvent(Event event) {
        eventsEmittedTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty() && recentEventTimestamps.peekFirst().isBefore(threshold)) {
            recentEventTimestamps.removeFirst();
        }
    }

    private void onTickStarted(CollectorTickStarted event) {
        feedStatuses.compute(event.collectorName(), (name, current) -> {
            FeedStatus status = current == null ? FeedStatus.empty() : current;
            return status.withLastRunAt(event.timestamp());
        });
    }

    private void onTickCompleted(CollectorTickCompleted event) {
        FeedStatus updated = feedStatuses.compute(event.collectorName(), (name, current) -> {
            FeedStatus status = current == null ? FeedStatus.empty() : current;
            return status.withCompletion(event.timestamp(), event.durationMillis(), event.success());
        });
        if (!event.success() && updated.consecutiveFailures() == NO_SIGNAL_AFTER_FAILURES) {
            LOGGER.warning(event.collectorName() + " has failed " + NO_SIGNAL_AFTER_FAILURES
                    + " cycles in a row: " + updated.lastErrorMessage());
        }
    }

    private void onAlertRaised(AlertRaised event) {
        if (AlertRaised.CATEGORY_ALERT.equals(event.category())) {
            alertsAnnouncedTotal.increment();
            return;
        }
        if (!AlertRaised.CATEGORY_COLLECTOR.equals(event.category()) || event.details() == null) {
            return;
        }
        Object collector = event.details().get("collector");
        if (!(collector instanceof String collectorName) || collectorName.isBlank()) {
            return;
        }
        feedStatuses.compute(collectorName, (name, current) -> {
            FeedStatus status = current == null ? FeedStatus.empty() : current;
            return status.withLastErrorMessage(event.message());
        });
    }

    private record FeedStatus(
            Instant lastRunAt,
            Long lastDurationMillis,
            Boolean lastSuccess,
            String lastErrorMessage,
            int consecutiveFailures
    ) {
        private static FeedStatus empty() {
            return new FeedStatus(null, null, null, null, 0);
        }

        private FeedStatus withLastRunAt(Instant runAt) {
            return new FeedStatus(runAt, lastDurationMillis, lastSuccess, lastErrorMessage, consecutiveFailures);
        }

        private FeedStatus withCompletion(Instant runAt, long durationMillis, boolean success) {
            return new FeedStatus(
                    runAt,
                    durationMillis,
                    success,
                    success ? null : lastErrorMessage,
                    success ? 0 : consecutiveFailures + 1
            );
        }

        private FeedStatus withLastErrorMessage(String message) {
            return new FeedStatus(lastRunAt, lastDurationMillis, lastSuccess, message, consecutiveFailures);
        }

        private FeedSignal signal() {
            if (lastSuccess == null) {
                return FeedSignal.UNKNOWN;
            }
            return consecutiveFailures >= NO_SIGNAL_AFTER_FAILURES ? FeedSignal.NO_SIGNAL : FeedSignal.OK;
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastRunAt", lastRunAt == null ? null : lastRunAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSuccess", lastSuccess);
            map.put("lastErrorMessage", lastErrorMessage);
            map.put("consecutiveFailures", consecutiveFailures);
            map.put("signal", signal().name());
            return map;
        }
    }
}
