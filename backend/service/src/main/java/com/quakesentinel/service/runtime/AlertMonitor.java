package com.quakesentinel.service.runtime;

import com.quakesentinel.collectors.api.Collector;
import com.quakesentinel.collectors.api.FeedSource;
import com.quakesentinel.collectors.feed.FeedCollector;
import com.quakesentinel.core.bus.EventBus;
import com.quakesentinel.core.classify.EventNormalizer;
import com.quakesentinel.core.classify.SeverityClassifier;
import com.quakesentinel.core.events.SyncRequested;
import com.quakesentinel.core.model.FeedType;
import com.quakesentinel.core.model.MonitorSnapshot;
import com.quakesentinel.core.translate.PlaceNameTranslator;
import com.quakesentinel.service.audio.AudioAlertSynthesizer;
import com.quakesentinel.service.config.MonitorConfig;
import com.quakesentinel.service.monitor.AlertArbitrator;
import com.quakesentinel.service.monitor.ArbitrationSettings;
import com.quakesentinel.service.simulation.TestModeController;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * The public face of the alert monitor: lifecycle, read-only snapshot, manual refresh and test mode.
 */
public class AlertMonitor implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(AlertMonitor.class.getName());

    private final AlertArbitrator arbitrator;
    private final PollerService poller;
    private final TestModeController testMode;
    private final AudioAlertSynthesizer audio;
    private final EventBus eventBus;
    private final Duration rotationInterval;
    private final Consumer<SyncRequested> syncHandler = this::onSyncRequested;
    private ScheduledExecutorService rotationTimer;

    public AlertMonitor(
            AlertArbitrator arbitrator,
            PollerService poller,
            TestModeController testMode,
            AudioAlertSynthesizer audio,
            EventBus eventBus,
            Duration rotationInterval
    ) {
        this.arbitrator = arbitrator;
        this.poller = poller;
        this.testMode = testMode;
        this.audio = audio;
        this.eventBus = eventBus;
        this.rotationInterval = rotationInterval;
    }

    public static AlertMonitor create(
            MonitorConfig config,
            FeedSource feedSource,
            AudioAlertSynthesizer audio,
            EventBus eventBus,
            Clock clock
    ) {
        SeverityClassifier classifier = new SeverityClassifier(clock, config.freshnessWindow());
        EventNormalizer normalizer = new EventNormalizer(classifier, PlaceNameTranslator.withDefaultDictionary());
        AlertArbitrator arbitrator = new AlertArbitrator(classifier, eventBus, audio, ArbitrationSettings.from(config));
        List<Collector> cadenceCollectors = List.of(
                new FeedCollector(FeedType.QUAKE, feedSource, normalizer),
                new FeedCollector(FeedType.TSUNAMI, feedSource, normalizer)
        );
        PollerService poller = new PollerService(
                new FeedCollector(FeedType.EEW, feedSource, normalizer),
                cadenceCollectors,
                arbitrator,
                eventBus,
                clock,
                PollerSettings.from(config),
                arbitrator::pollCadenceMillis
        );
        TestModeController testMode = new TestModeController(arbitrator, poller, normalizer, clock);
        return new AlertMonitor(arbitrator, poller, testMode, audio, eventBus, config.rotationInterval());
    }

    public synchronized void start() {
        if (rotationTimer != null) {
            return;
        }
        eventBus.subscribe(SyncRequested.class, syncHandler);
        poller.start();
        rotationTimer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "display-rotation");
            thread.setDaemon(true);
            return thread;
        });
        long rotationMillis = rotationInterval.toMillis();
        rotationTimer.scheduleAtFixedRate(arbitrator::rotate, rotationMillis, rotationMillis, TimeUnit.MILLISECONDS);
        LOGGER.info("Alert monitor started");
    }

    public synchronized void stop() {
        eventBus.unsubscribe(SyncRequested.class, syncHandler);
        if (rotationTimer != null) {
            rotationTimer.shutdownNow();
            rotationTimer = null;
        }
        poller.shutdown();
        audio.close();
        LOGGER.info("Alert monitor stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public MonitorSnapshot snapshot() {
        return arbitrator.snapshot();
    }

    public MonitorSnapshot manualRefresh() {
        poller.runOnceAllCollectors();
        return arbitrator.snapshot();
    }

    public void enterTest() {
        testMode.enterTest();
    }

    public void exitTest() {
        testMode.exitTest();
    }

    AlertArbitrator arbitrator() {
        return arbitrator;
    }

    PollerService poller() {
        return poller;
    }

    private void onSyncRequested(SyncRequested event) {
        LOGGER.fine(() -> "Sync requested by " + event.origin());
        poller.pollAllAsync();
    }
}
