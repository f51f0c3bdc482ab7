package com.quakesentinel.service.audio;

import java.util.Objects;

/**
 * One oscillator voice: frequency sweeps exponentially from {@code startHz} to {@code endHz} and the
 * gain decays exponentially from {@code gain} to {@code endGain} over the voice's duration.
 */
public record ToneSpec(
        Waveform waveform,
        double startHz,
        double endHz,
        double offsetSeconds,
        double durationSeconds,
        double gain,
        double endGain
) {
    public ToneSpec {
        Objects.requireNonNull(waveform, "waveform is required");
        if (startHz <= 0 || endHz <= 0) {
            throw new IllegalArgumentException("frequencies must be positive");
        }
        if (offsetSeconds < 0 || durationSeconds <= 0) {
            throw new IllegalArgumentException("tone must have a non-negative offset and a positive duration");
        }
        if (gain <= 0 || endGain <= 0 || gain > 1 || endGain > 1) {
            throw new IllegalArgumentException("gains must be in (0, 1]");
        }
    }

    public double endSeconds() {
        return offsetSeconds + durationSeconds;
    }

    void mixInto(double[] buffer, int sampleRate) {
        int first = (int) Math.round(offsetSeconds * sampleRate);
        int frames = (int) Math.round(durationSeconds * sampleRate);
        double phase = 0;
        for (int i = 0; i < frames && first + i < buffer.length; i++) {
            double progress = (double) i / frames;
            double frequency = startHz * Math.pow(endHz / startHz, progress);
            double amplitude = gain * Math.pow(endGain / gain, progress);
            buffer[first + i] += amplitude * waveform.sample(phase);
            phase += 2 * Math.PI * frequency / sampleRate;
        }
    }
}
