package com.quakesentinel.core.model;

import java.time.Instant;

/**
 * Classified, display-ready event. Implementations are immutable and replaced wholesale on update.
 */
public interface NormalizedEvent {
    FeedType feedType();

    Instant occurredAt();

    SeverityLevel severity();

    boolean cancelled();

    String placeName();
}
