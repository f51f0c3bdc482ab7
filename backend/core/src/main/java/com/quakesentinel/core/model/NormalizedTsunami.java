package com.quakesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record NormalizedTsunami(
        Instant occurredAt,
        boolean cancelled,
        List<String> areaNames,
        TsunamiGrade worstGrade,
        SeverityLevel severity
) implements NormalizedEvent {
    public NormalizedTsunami {
        Objects.requireNonNull(occurredAt, "occurredAt is required");
        Objects.requireNonNull(severity, "severity is required");
        areaNames = areaNames == null ? List.of() : List.copyOf(areaNames);
    }

    @Override
    @JsonProperty("feedType")
    public FeedType feedType() {
        return FeedType.TSUNAMI;
    }

    /**
     * Area names joined for single-line display.
     */
    @Override
    @JsonProperty("placeName")
    public String placeName() {
        return String.join(" / ", areaNames);
    }
}
