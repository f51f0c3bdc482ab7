package com.quakesentinel.core.events;

import com.quakesentinel.core.model.FeedType;
import com.quakesentinel.core.model.SeverityLevel;

import java.time.Instant;

public record MonitorUpdated(
        Instant timestamp,
        FeedType feedType,
        Instant occurredAt,
        SeverityLevel severity,
        String placeName,
        boolean announced
) implements Event {
    @Override
    public String type() {
        return "MonitorUpdated";
    }
}
