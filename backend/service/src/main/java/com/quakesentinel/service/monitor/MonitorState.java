package com.quakesentinel.service.monitor;

import com.quakesentinel.core.model.DisplayMode;
import com.quakesentinel.core.model.FeedType;
import com.quakesentinel.core.model.MonitorSnapshot;
import com.quakesentinel.core.model.NormalizedEew;
import com.quakesentinel.core.model.NormalizedEvent;
import com.quakesentinel.core.model.NormalizedQuake;
import com.quakesentinel.core.model.NormalizedTsunami;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Mutable monitor state. Only {@link AlertArbitrator} touches it, always under its lock.
 */
final class MonitorState {
    NormalizedQuake latestQuake;
    NormalizedTsunami latestTsunami;
    NormalizedEew latestEew;
    DisplayMode displayMode = DisplayMode.SEISMIC;
    long pollCadenceMillis;
    boolean testModeActive;
    final Map<FeedType, Instant> lastFiredAt = new EnumMap<>(FeedType.class);

    // EEW state captured on entering test mode, put back on exit.
    NormalizedEew eewBeforeTest;
    Instant eewFiredAtBeforeTest;

    MonitorState(long pollCadenceMillis) {
        this.pollCadenceMillis = pollCadenceMillis;
    }

    void store(NormalizedEvent event) {
        if (event instanceof NormalizedQuake quake) {
            latestQuake = quake;
        } else if (event instanceof NormalizedTsunami tsunami) {
            latestTsunami = tsunami;
        } else if (event instanceof NormalizedEew eew) {
            latestEew = eew;
        } else {
            throw new IllegalArgumentException("Unsupported event: " + event);
        }
    }

    MonitorSnapshot snapshot(Instant now) {
        return new MonitorSnapshot(
                now,
                latestQuake,
                latestTsunami,
                latestEew,
                displayMode,
                pollCadenceMillis,
                testModeActive,
                lastFiredAt
        );
    }
}
