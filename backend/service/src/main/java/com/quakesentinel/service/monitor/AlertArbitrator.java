package com.quakesentinel.service.monitor;

import com.quakesentinel.collectors.api.MonitorSink;
import com.quakesentinel.core.bus.EventBus;
import com.quakesentinel.core.classify.SeverityClassifier;
import com.quakesentinel.core.events.AlertRaised;
import com.quakesentinel.core.events.DisplayModeChanged;
import com.quakesentinel.core.events.Event;
import com.quakesentinel.core.events.MonitorUpdated;
import com.quakesentinel.core.events.PollCadenceChanged;
import com.quakesentinel.core.events.TestModeChanged;
import com.quakesentinel.core.model.AlertClass;
import com.quakesentinel.core.model.DisplayMode;
import com.quakesentinel.core.model.FeedType;
import com.quakesentinel.core.model.MonitorSnapshot;
import com.quakesentinel.core.model.NormalizedEew;
import com.quakesentinel.core.model.NormalizedEvent;
import com.quakesentinel.core.model.NormalizedQuake;
import com.quakesentinel.core.model.NormalizedTsunami;
import com.quakesentinel.service.audio.AudioAlertSynthesizer;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Single writer of the monitor state. Every update runs under one lock: store the event, apply the
 * dedup/fire rule, then recompute display mode and poll cadence. {@code lastFiredAt} per feed is a
 * high-water mark; a record older than it is ignored. Bus events and audio are emitted
 * after the lock is released.
 */
public class AlertArbitrator implements MonitorSink {
    private static final Logger LOGGER = Logger.getLogger(AlertArbitrator.class.getName());

    private final SeverityClassifier classifier;
    private final EventBus eventBus;
    private final AudioAlertSynthesizer audio;
    private final ArbitrationSettings settings;
    private final Object lock = new Object();
    private final MonitorState state;

    public AlertArbitrator(
            SeverityClassifier classifier,
            EventBus eventBus,
            AudioAlertSynthesizer audio,
            ArbitrationSettings settings
    ) {
        this.classifier = Objects.requireNonNull(classifier, "classifier is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.audio = Objects.requireNonNull(audio, "audio is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.state = new MonitorState(settings.baselineCadence().toMillis());
    }

    /**
     * Live feed delivery. Ignored while test mode is active.
     */
    @Override
    public void deliver(NormalizedEvent event) {
        Update update;
        synchronized (lock) {
            if (state.testModeActive) {
                LOGGER.fine(() -> "Test mode active; dropping live " + event.feedType() + " update");
                return;
            }
            update = apply(event);
        }
        emit(update);
    }

    /**
     * Delivery from the test controller; accepted in test mode.
     */
    public void acceptSimulated(NormalizedEvent event) {
        Update update;
        synchronized (lock) {
            update = apply(event);
        }
        emit(update);
    }

    /**
     * Re-checks staleness against the clock, which may release the EEW override or relax the cadence.
     * State is frozen while test mode is active; leaving test mode recomputes it.
     */
    public MonitorSnapshot reevaluate() {
        Update update;
        synchronized (lock) {
            update = new Update(classifier.clock().instant());
            if (!state.testModeActive) {
                recompute(update);
            }
            update.snapshot = state.snapshot(update.now);
        }
        emit(update);
        return update.snapshot;
    }

    /**
     * Advances Seismic/Tsunami rotation unless EEW (live or simulated) is holding the display. A tick
     * that releases the EEW hold lands on Seismic. Does nothing while test mode is active.
     */
    public MonitorSnapshot rotate() {
        Update update;
        synchronized (lock) {
            update = new Update(classifier.clock().instant());
            if (state.testModeActive) {
                return state.snapshot(update.now);
            }
            DisplayMode before = state.displayMode;
            recompute(update);
            if (before != DisplayMode.EEW && !eewForced(update.now)) {
                changeDisplay(update, state.displayMode.rotated());
            }
            update.snapshot = state.snapshot(update.now);
        }
        emit(update);
        return update.snapshot;
    }

    public long pollCadenceMillis() {
        return reevaluate().pollCadenceMillis();
    }

    public MonitorSnapshot snapshot() {
        synchronized (lock) {
            return state.snapshot(classifier.clock().instant());
        }
    }

    public boolean isTestModeActive() {
        synchronized (lock) {
            return state.testModeActive;
        }
    }

    public void beginTestMode() {
        Update update;
        synchronized (lock) {
            if (state.testModeActive) {
                return;
            }
            update = new Update(classifier.clock().instant());
            state.eewBeforeTest = state.latestEew;
            state.eewFiredAtBeforeTest = state.lastFiredAt.remove(FeedType.EEW);
            state.testModeActive = true;
            update.events.add(new TestModeChanged(update.now, true));
            recompute(update);
        }
        emit(update);
    }

    public void endTestMode() {
        Update update;
        synchronized (lock) {
            if (!state.testModeActive) {
                return;
            }
            update = new Update(classifier.clock().instant());
            state.latestEew = state.eewBeforeTest;
            if (state.eewFiredAtBeforeTest == null) {
                state.lastFiredAt.remove(FeedType.EEW);
            } else {
                state.lastFiredAt.put(FeedType.EEW, state.eewFiredAtBeforeTest);
            }
            state.eewBeforeTest = null;
            state.eewFiredAtBeforeTest = null;
            state.testModeActive = false;
            update.events.add(new TestModeChanged(update.now, false));
            recompute(update);
        }
        emit(update);
    }

    private Update apply(NormalizedEvent event) {
        Update update = new Update(classifier.clock().instant());
        FeedType feedType = event.feedType();
        Instant highWater = state.lastFiredAt.get(feedType);
        if (highWater != null && event.occurredAt().isBefore(highWater)) {
            LOGGER.fine(() -> "Ignoring " + feedType + " record from " + event.occurredAt()
                    + "; already holding " + highWater);
            return update;
        }
        state.store(event);

        boolean novel = !event.occurredAt().equals(highWater);
        if (novel) {
            state.lastFiredAt.put(feedType, event.occurredAt());
        }
        Optional<AlertClass> alertClass = novel && !event.cancelled()
                ? AlertClass.forSeverity(event.severity())
                : Optional.empty();
        update.events.add(new MonitorUpdated(
                update.now,
                feedType,
                event.occurredAt(),
                event.severity(),
                event.placeName(),
                alertClass.isPresent()
        ));
        alertClass.ifPresent(cls -> {
            update.alertClass = cls;
            update.events.add(new AlertRaised(
                    update.now,
                    AlertRaised.CATEGORY_ALERT,
                    feedType + " " + event.severity() + ": " + event.placeName(),
                    Map.of(
                            "feedType", feedType.name(),
                            "severity", event.severity().name(),
                            "alertClass", cls.name(),
                            "occurredAt", event.occurredAt().toString()
                    )
            ));
        });
        recompute(update);
        return update;
    }

    private void recompute(Update update) {
        Instant now = update.now;
        DisplayMode next = state.displayMode;
        if (eewForced(now)) {
            next = DisplayMode.EEW;
        } else if (next == DisplayMode.EEW) {
            next = DisplayMode.SEISMIC;
        }
        changeDisplay(update, next);

        long cadence = emergencyActive(now)
                ? settings.emergencyCadence().toMillis()
                : settings.baselineCadence().toMillis();
        if (cadence != state.pollCadenceMillis) {
            update.events.add(new PollCadenceChanged(now, state.pollCadenceMillis, cadence));
            state.pollCadenceMillis = cadence;
        }
    }

    private void changeDisplay(Update update, DisplayMode next) {
        if (next != state.displayMode) {
            update.events.add(new DisplayModeChanged(update.now, state.displayMode, next));
            state.displayMode = next;
        }
    }

    private boolean eewForced(Instant now) {
        return state.testModeActive || eewActive(now);
    }

    private boolean eewActive(Instant now) {
        NormalizedEew eew = state.latestEew;
        return eew != null && !eew.cancelled() && !stale(eew, now);
    }

    private boolean emergencyActive(Instant now) {
        if (eewActive(now)) {
            return true;
        }
        NormalizedQuake quake = state.latestQuake;
        if (quake != null && quake.magnitude() != null
                && quake.magnitude() >= settings.emergencyMagnitude() && !stale(quake, now)) {
            return true;
        }
        NormalizedTsunami tsunami = state.latestTsunami;
        return tsunami != null && !tsunami.cancelled() && !stale(tsunami, now);
    }

    private boolean stale(NormalizedEvent event, Instant now) {
        return Duration.between(event.occurredAt(), now).compareTo(classifier.freshnessWindow()) > 0;
    }

    private void emit(Update update) {
        if (update.alertClass != null) {
            LOGGER.info("Announcing " + update.alertClass + " alert");
            audio.play(update.alertClass);
        }
        for (Event event : update.events) {
            eventBus.publish(event);
        }
    }

    private static final class Update {
        private final Instant now;
        private final List<Event> events = new ArrayList<>();
        private AlertClass alertClass;
        private MonitorSnapshot snapshot;

        private Update(Instant now) {
            this.now = now;
        }
    }
}
