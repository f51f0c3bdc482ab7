package com.quakesentinel.collectors.api;

import java.util.Map;

public record CollectorResult(boolean success, boolean updated, String message, Map<String, Object> stats) {
    public CollectorResult {
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }

    public static CollectorResult updated(String message, Map<String, Object> stats) {
        return new CollectorResult(true, true, message, stats);
    }

    public static CollectorResult noUpdate(String message, Map<String, Object> stats) {
        return new CollectorResult(true, false, message, stats);
    }

    public static CollectorResult failure(String message, Map<String, Object> stats) {
        return new CollectorResult(false, false, message, stats);
    }
}
