package com.quakesentinel.core.model;

import java.util.Optional;

public enum AlertClass {
    EMERGENCY,
    STANDARD;

    public static Optional<AlertClass> forSeverity(SeverityLevel severity) {
        if (severity.isAtLeast(SeverityLevel.MAJOR)) {
            return Optional.of(EMERGENCY);
        }
        if (severity.isActive()) {
            return Optional.of(STANDARD);
        }
        return Optional.empty();
    }
}
