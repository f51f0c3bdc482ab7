package com.quakesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

public record NormalizedEew(
        Instant occurredAt,
        String placeName,
        EewIssueKind issueKind,
        boolean cancelled,
        SeverityLevel severity,
        boolean synthetic
) implements NormalizedEvent {
    public NormalizedEew {
        Objects.requireNonNull(occurredAt, "occurredAt is required");
        Objects.requireNonNull(severity, "severity is required");
    }

    @Override
    @JsonProperty("feedType")
    public FeedType feedType() {
        return FeedType.EEW;
    }

    public NormalizedEew asSynthetic() {
        return new NormalizedEew(occurredAt, placeName, issueKind, cancelled, severity, true);
    }
}
