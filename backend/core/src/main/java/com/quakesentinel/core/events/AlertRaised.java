package com.quakesentinel.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Raised for announced alerts (category {@code alert}) and for feed failures (category {@code collector}).
 */
public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public static final String CATEGORY_ALERT = "alert";
    public static final String CATEGORY_COLLECTOR = "collector";

    @Override
    public String type() {
        return "AlertRaised";
    }
}
