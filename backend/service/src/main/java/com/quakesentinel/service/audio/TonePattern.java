package com.quakesentinel.service.audio;

import java.util.List;

public record TonePattern(String name, List<ToneSpec> tones) {
    public TonePattern {
        tones = List.copyOf(tones);
        if (tones.isEmpty()) {
            throw new IllegalArgumentException("pattern " + name + " has no tones");
        }
    }

    public double durationSeconds() {
        return tones.stream().mapToDouble(ToneSpec::endSeconds).max().orElse(0);
    }

    /**
     * Mixes all voices into signed 16-bit little-endian mono PCM, clipping at full scale.
     */
    public byte[] renderPcm16(int sampleRate) {
        int frames = (int) Math.ceil(durationSeconds() * sampleRate);
        double[] mix = new double[frames];
        for (ToneSpec tone : tones) {
            tone.mixInto(mix, sampleRate);
        }
        byte[] pcm = new byte[frames * 2];
        for (int i = 0; i < frames; i++) {
            double clipped = Math.max(-1.0, Math.min(1.0, mix[i]));
            short sample = (short) Math.round(clipped * Short.MAX_VALUE);
            pcm[2 * i] = (byte) (sample & 0xff);
            pcm[2 * i + 1] = (byte) ((sample >> 8) & 0xff);
        }
        return pcm;
    }
}
