package com.quakesentinel.service.runtime;

import com.quakesentinel.collectors.api.Collector;
import com.quakesentinel.collectors.api.CollectorContext;
import com.quakesentinel.collectors.api.CollectorResult;
import com.quakesentinel.collectors.api.MonitorSink;
import com.quakesentinel.core.bus.EventBus;
import com.quakesentinel.core.events.AlertRaised;
import com.quakesentinel.core.model.NormalizedEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Runs the feed collectors: the EEW collector on a fixed rate, the quake and tsunami collectors on a
 * cadence re-read before every cycle, and an on-demand poll of everything.
 *
 * <p>While suspended no cycle starts. Every suspend or resume also starts a new generation, and results
 * fetched under an older generation are discarded instead of being delivered.
 */
public class PollerService {
    private static final Logger LOGGER = Logger.getLogger(PollerService.class.getName());

    private final Collector eewCollector;
    private final List<Collector> cadenceCollectors;
    private final MonitorSink sink;
    private final EventBus eventBus;
    private final Clock clock;
    private final PollerSettings settings;
    private final LongSupplier cadenceMillis;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(named("poller-timer"));
    private final ExecutorService collectorExecutor = Executors.newCachedThreadPool(named("feed-poll"));
    private final List<ScheduledFuture<?>> timers = new CopyOnWriteArrayList<>();
    private final AtomicLong generation = new AtomicLong();
    private volatile boolean suspended;
    private volatile boolean running;

    public PollerService(
            Collector eewCollector,
            List<Collector> cadenceCollectors,
            MonitorSink sink,
            EventBus eventBus,
            Clock clock,
            PollerSettings settings,
            LongSupplier cadenceMillis
    ) {
        this(eewCollector, cadenceCollectors, sink, eventBus, clock, settings, cadenceMillis, 100);
    }

    PollerService(
            Collector eewCollector,
            List<Collector> cadenceCollectors,
            MonitorSink sink,
            EventBus eventBus,
            Clock clock,
            PollerSettings settings,
            LongSupplier cadenceMillis,
            long minIntervalMillis
    ) {
        this.eewCollector = Objects.requireNonNull(eewCollector, "eewCollector is required");
        this.cadenceCollectors = List.copyOf(cadenceCollectors);
        this.sink = Objects.requireNonNull(sink, "sink is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.cadenceMillis = Objects.requireNonNull(cadenceMillis, "cadenceMillis is required");
        this.minIntervalMillis = minIntervalMillis;
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        long eewMillis = Math.max(minIntervalMillis, settings.eewInterval().toMillis());
        timers.add(timerExecutor.scheduleAtFixedRate(this::tickEew, 0, eewMillis, TimeUnit.MILLISECONDS));
        scheduleCadenceCycle(0);
        LOGGER.info("Poller started: EEW every " + eewMillis + "ms, quake/tsunami every "
                + cadenceMillis.getAsLong() + "ms");
    }

    public void suspend() {
        suspended = true;
        generation.incrementAndGet();
        LOGGER.info("Poller suspended");
    }

    public void resume() {
        generation.incrementAndGet();
        suspended = false;
        LOGGER.info("Poller resumed");
    }

    public boolean isSuspended() {
        return suspended;
    }

    /**
     * Polls every feed concurrently without touching the timers.
     */
    public CompletableFuture<List<CollectorResult>> pollAllAsync() {
        List<Collector> all = new ArrayList<>();
        all.add(eewCollector);
        all.addAll(cadenceCollectors);
        return runCycle(all);
    }

    public List<CollectorResult> runOnceAllCollectors() {
        return pollAllAsync().join();
    }

    public void shutdown() {
        running = false;
        timers.forEach(timer -> timer.cancel(false));
        timers.clear();
        timerExecutor.shutdown();
        collectorExecutor.shutdown();
        try {
            if (!timerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                timerExecutor.shutdownNow();
            }
            if (!collectorExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                collectorExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    CompletableFuture<List<CollectorResult>> tickEew() {
        return runCycle(List.of(eewCollector));
    }

    CompletableFuture<List<CollectorResult>> tickCadenceFeeds() {
        return runCycle(cadenceCollectors);
    }

    private void scheduleCadenceCycle(long delayMillis) {
        if (!running || timerExecutor.isShutdown()) {
            return;
        }
        timers.removeIf(ScheduledFuture::isDone);
        // The next wait is read after this cycle has delivered, so an emergency it finds applies at once.
        timers.add(timerExecutor.schedule(() -> {
            tickCadenceFeeds().whenComplete((results, error) -> scheduleNextCadenceCycle());
        }, delayMillis, TimeUnit.MILLISECONDS));
    }

    private void scheduleNextCadenceCycle() {
        try {
            scheduleCadenceCycle(Math.max(minIntervalMillis, cadenceMillis.getAsLong()));
        } catch (RejectedExecutionException e) {
            LOGGER.fine("Poller stopped; quake/tsunami cycle not rescheduled");
        }
    }

    private CompletableFuture<List<CollectorResult>> runCycle(List<Collector> collectors) {
        if (suspended) {
            LOGGER.fine("Poller suspended; skipping cycle");
            return CompletableFuture.completedFuture(List.of());
        }
        long cycleGeneration = generation.get();
        List<CompletableFuture<CollectorResult>> tasks = new ArrayList<>();
        for (Collector collector : collectors) {
            tasks.add(CompletableFuture.supplyAsync(
                    () -> runCollectorSafely(collector, cycleGeneration),
                    collectorExecutor
            ));
        }
        return CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> tasks.stream().map(CompletableFuture::join).toList());
    }

    private CollectorResult runCollectorSafely(Collector collector, long cycleGeneration) {
        CollectorContext context = new CollectorContext(
                eventBus,
                event -> deliverIfCurrent(event, cycleGeneration),
                clock,
                settings.requestTimeout(),
                collectorExecutor
        );
        try {
            return collector.poll(context).join();
        } catch (Exception ex) {
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    AlertRaised.CATEGORY_COLLECTOR,
                    "Collector run failed: " + collector.name() + " - " + ex.getMessage(),
                    Map.of("collector", collector.name())
            ));
            return CollectorResult.failure(
                    "Collector run failed: " + collector.name(),
                    Map.of("collector", collector.name())
            );
        }
    }

    private void deliverIfCurrent(NormalizedEvent event, long cycleGeneration) {
        if (suspended || generation.get() != cycleGeneration) {
            LOGGER.fine(() -> "Discarding " + event.feedType() + " result fetched before suspend/resume");
            return;
        }
        sink.deliver(event);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
