package com.quakesentinel.core.model;

import java.time.Instant;
import java.util.Objects;

public record EewEvent(
        Instant occurredAt,
        String epicenterRaw,
        boolean cancelled,
        EewIssueKind issueKind
) implements RawEventRecord {
    public EewEvent {
        Objects.requireNonNull(occurredAt, "occurredAt is required");
        epicenterRaw = epicenterRaw == null ? "" : epicenterRaw;
        issueKind = issueKind == null ? EewIssueKind.WARNING : issueKind;
    }

    @Override
    public FeedType feedType() {
        return FeedType.EEW;
    }
}
