package com.quakesentinel.core.model;

/**
 * JMA seismic intensity as reported in feed scale codes.
 */
public enum JmaIntensity {
    UNKNOWN(-1, "?"),
    ONE(10, "1"),
    TWO(20, "2"),
    THREE(30, "3"),
    FOUR(40, "4"),
    FIVE_LOWER(45, "5-"),
    FIVE_UPPER(50, "5+"),
    SIX_LOWER(55, "6-"),
    SIX_UPPER(60, "6+"),
    SEVEN(70, "7");

    private final int code;
    private final String label;

    JmaIntensity(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int code() {
        return code;
    }

    public String label() {
        return label;
    }

    public static JmaIntensity fromCode(int code) {
        for (JmaIntensity intensity : values()) {
            if (intensity.code == code) {
                return intensity;
            }
        }
        return UNKNOWN;
    }
}
