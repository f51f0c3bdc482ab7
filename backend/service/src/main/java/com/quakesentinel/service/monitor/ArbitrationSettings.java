package com.quakesentinel.service.monitor;

import com.quakesentinel.service.config.MonitorConfig;

import java.time.Duration;
import java.util.Objects;

public record ArbitrationSettings(Duration baselineCadence, Duration emergencyCadence, double emergencyMagnitude) {
    public ArbitrationSettings {
        Objects.requireNonNull(baselineCadence, "baselineCadence is required");
        Objects.requireNonNull(emergencyCadence, "emergencyCadence is required");
    }

    public static ArbitrationSettings from(MonitorConfig config) {
        return new ArbitrationSettings(
                config.cadence().baseline(),
                config.cadence().emergency(),
                config.emergencyMagnitude()
        );
    }

    public static ArbitrationSettings defaults() {
        return from(MonitorConfig.defaults());
    }
}
