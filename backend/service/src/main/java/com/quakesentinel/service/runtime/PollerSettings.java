package com.quakesentinel.service.runtime;

import com.quakesentinel.service.config.MonitorConfig;

import java.time.Duration;
import java.util.Objects;

public record PollerSettings(Duration eewInterval, Duration requestTimeout) {
    public PollerSettings {
        Objects.requireNonNull(eewInterval, "eewInterval is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
    }

    public static PollerSettings from(MonitorConfig config) {
        return new PollerSettings(config.cadence().eewInterval(), config.feeds().requestTimeout());
    }
}
