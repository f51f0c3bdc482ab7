package com.quakesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

public record NormalizedQuake(
        Instant occurredAt,
        String placeName,
        Double magnitude,
        JmaIntensity maxIntensity,
        Double depthKm,
        SeverityLevel severity
) implements NormalizedEvent {
    public NormalizedQuake {
        Objects.requireNonNull(occurredAt, "occurredAt is required");
        Objects.requireNonNull(severity, "severity is required");
        maxIntensity = maxIntensity == null ? JmaIntensity.UNKNOWN : maxIntensity;
    }

    @Override
    @JsonProperty("feedType")
    public FeedType feedType() {
        return FeedType.QUAKE;
    }

    @Override
    public boolean cancelled() {
        return false;
    }
}
