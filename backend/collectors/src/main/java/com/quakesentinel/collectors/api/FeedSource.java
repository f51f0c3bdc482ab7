package com.quakesentinel.collectors.api;

import com.quakesentinel.core.model.FeedType;
import com.quakesentinel.core.model.RawEventRecord;

import java.util.Optional;

/**
 * Fetches the most recent record of a feed. Empty when the feed currently has no records; transport
 * and format problems are thrown as unchecked exceptions for the collector to absorb.
 */
@FunctionalInterface
public interface FeedSource {
    Optional<RawEventRecord> fetchLatest(FeedType feedType);
}
