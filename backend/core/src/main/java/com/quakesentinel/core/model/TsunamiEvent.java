package com.quakesentinel.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record TsunamiEvent(Instant occurredAt, boolean cancelled, List<TsunamiArea> areas) implements RawEventRecord {
    public TsunamiEvent {
        Objects.requireNonNull(occurredAt, "occurredAt is required");
        areas = areas == null ? List.of() : List.copyOf(areas);
    }

    @Override
    public FeedType feedType() {
        return FeedType.TSUNAMI;
    }
}
