package com.quakesentinel.core.model;

import java.time.Instant;
import java.util.Objects;

public record QuakeEvent(
        Instant occurredAt,
        String epicenterRaw,
        Double magnitude,
        int maxIntensityCode,
        Double depthKm
) implements RawEventRecord {
    public QuakeEvent {
        Objects.requireNonNull(occurredAt, "occurredAt is required");
        epicenterRaw = epicenterRaw == null ? "" : epicenterRaw;
    }

    @Override
    public FeedType feedType() {
        return FeedType.QUAKE;
    }
}
