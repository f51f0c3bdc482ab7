package com.quakesentinel.core.model;

import java.util.Locale;

/**
 * Tsunami area grades in ascending priority.
 */
public enum TsunamiGrade {
    UNKNOWN("Unknown", SeverityLevel.WATCH),
    WATCH("Watch", SeverityLevel.ALERT),
    WARNING("Warning", SeverityLevel.WARNING),
    MAJOR_WARNING("MajorWarning", SeverityLevel.MAJOR);

    private final String wireName;
    private final SeverityLevel severity;

    TsunamiGrade(String wireName, SeverityLevel severity) {
        this.wireName = wireName;
        this.severity = severity;
    }

    public String wireName() {
        return wireName;
    }

    public SeverityLevel severity() {
        return severity;
    }

    public static TsunamiGrade fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        for (TsunamiGrade grade : values()) {
            if (grade.wireName.toLowerCase(Locale.ROOT).equals(trimmed)) {
                return grade;
            }
        }
        return UNKNOWN;
    }
}
