package com.quakesentinel.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of the monitor state for rendering.
 */
public record MonitorSnapshot(
        Instant capturedAt,
        NormalizedQuake latestQuake,
        NormalizedTsunami latestTsunami,
        NormalizedEew latestEew,
        DisplayMode displayMode,
        long pollCadenceMillis,
        boolean testModeActive,
        Map<FeedType, Instant> lastFiredAt
) {
    public MonitorSnapshot {
        lastFiredAt = lastFiredAt == null ? Map.of() : Map.copyOf(lastFiredAt);
    }
}
