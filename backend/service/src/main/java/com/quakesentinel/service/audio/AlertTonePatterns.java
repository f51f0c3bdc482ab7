package com.quakesentinel.service.audio;

import com.quakesentinel.core.model.AlertClass;

import java.util.ArrayList;
import java.util.List;

public final class AlertTonePatterns {
    static final int EMERGENCY_BEEPS = 5;
    static final double EMERGENCY_BEEP_HZ = 1200;
    static final double EMERGENCY_BEEP_SECONDS = 0.1;
    static final double EMERGENCY_SPACING_SECONDS = 0.15;
    static final double EMERGENCY_BED_HZ = 440;

    static final int STANDARD_BEEPS = 2;
    static final double STANDARD_BEEP_HZ = 880;
    static final double STANDARD_BEEP_SECONDS = 0.25;
    static final double STANDARD_SPACING_SECONDS = 0.5;

    public static final TonePattern EMERGENCY = emergency();
    public static final TonePattern STANDARD = standard();

    private AlertTonePatterns() {
    }

    public static TonePattern forClass(AlertClass alertClass) {
        return alertClass == AlertClass.EMERGENCY ? EMERGENCY : STANDARD;
    }

    // Falling square chirps over a low sine bed that lasts the whole burst.
    private static TonePattern emergency() {
        List<ToneSpec> tones = new ArrayList<>();
        for (int i = 0; i < EMERGENCY_BEEPS; i++) {
            tones.add(new ToneSpec(
                    Waveform.SQUARE,
                    EMERGENCY_BEEP_HZ,
                    EMERGENCY_BEEP_HZ / 2,
                    i * EMERGENCY_SPACING_SECONDS,
                    EMERGENCY_BEEP_SECONDS,
                    0.3,
                    0.03
            ));
        }
        double bedSeconds = (EMERGENCY_BEEPS - 1) * EMERGENCY_SPACING_SECONDS + EMERGENCY_BEEP_SECONDS;
        tones.add(new ToneSpec(Waveform.SINE, EMERGENCY_BED_HZ, EMERGENCY_BED_HZ, 0, bedSeconds, 0.2, 0.1));
        return new TonePattern("emergency", tones);
    }

    private static TonePattern standard() {
        List<ToneSpec> tones = new ArrayList<>();
        for (int i = 0; i < STANDARD_BEEPS; i++) {
            tones.add(new ToneSpec(
                    Waveform.SINE,
                    STANDARD_BEEP_HZ,
                    STANDARD_BEEP_HZ,
                    i * STANDARD_SPACING_SECONDS,
                    STANDARD_BEEP_SECONDS,
                    0.25,
                    0.02
            ));
        }
        return new TonePattern("standard", tones);
    }
}
