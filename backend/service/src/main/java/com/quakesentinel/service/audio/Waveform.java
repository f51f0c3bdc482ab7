package com.quakesentinel.service.audio;

public enum Waveform {
    SINE,
    SQUARE;

    double sample(double phase) {
        double value = Math.sin(phase);
        if (this == SQUARE) {
            return value >= 0 ? 1.0 : -1.0;
        }
        return value;
    }
}
