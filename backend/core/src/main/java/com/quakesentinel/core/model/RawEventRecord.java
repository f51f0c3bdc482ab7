package com.quakesentinel.core.model;

import java.time.Instant;

/**
 * A single record as retrieved from a feed, before classification and translation.
 */
public interface RawEventRecord {
    FeedType feedType();

    Instant occurredAt();
}
