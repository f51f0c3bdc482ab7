package com.quakesentinel.service.config;

import com.quakesentinel.collectors.config.FeedSettings;

import java.time.Duration;

/**
 * Monitor configuration as read from {@code monitor.json}. Every field is optional; missing values take
 * the defaults below.
 */
public record MonitorConfig(
        FeedSettings feeds,
        Cadence cadence,
        Duration freshnessWindow,
        Duration rotationInterval,
        Double emergencyMagnitude,
        Audio audio,
        Api api
) {
    public MonitorConfig {
        feeds = feeds == null ? FeedSettings.defaults() : feeds;
        cadence = cadence == null ? new Cadence(null, null, null) : cadence;
        freshnessWindow = positiveOr(freshnessWindow, Duration.ofSeconds(180), "freshnessWindow");
        rotationInterval = positiveOr(rotationInterval, Duration.ofSeconds(10), "rotationInterval");
        emergencyMagnitude = emergencyMagnitude == null ? 6.0 : emergencyMagnitude;
        audio = audio == null ? new Audio(null) : audio;
        api = api == null ? new Api(null, 0) : api;
    }

    public static MonitorConfig defaults() {
        return new MonitorConfig(null, null, null, null, null, null, null);
    }

    public record Cadence(Duration eewInterval, Duration baseline, Duration emergency) {
        public Cadence {
            eewInterval = positiveOr(eewInterval, Duration.ofSeconds(5), "cadence.eewInterval");
            baseline = positiveOr(baseline, Duration.ofSeconds(30), "cadence.baseline");
            emergency = positiveOr(emergency, Duration.ofSeconds(6), "cadence.emergency");
        }
    }

    public record Audio(Boolean enabled) {
        public Audio {
            enabled = enabled == null ? Boolean.TRUE : enabled;
        }
    }

    public record Api(Boolean enabled, int port) {
        public Api {
            enabled = enabled == null ? Boolean.TRUE : enabled;
            port = port <= 0 ? 8080 : port;
        }
    }

    private static Duration positiveOr(Duration value, Duration fallback, String key) {
        if (value == null) {
            return fallback;
        }
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(key + " must be positive but was " + value);
        }
        return value;
    }
}
