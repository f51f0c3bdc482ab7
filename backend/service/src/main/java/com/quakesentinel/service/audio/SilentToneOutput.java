package com.quakesentinel.service.audio;

import java.util.logging.Logger;

/**
 * Used when audio is disabled in configuration; logs instead of playing.
 */
public class SilentToneOutput implements ToneOutput {
    private static final Logger LOGGER = Logger.getLogger(SilentToneOutput.class.getName());

    @Override
    public void play(TonePattern pattern) {
        LOGGER.fine(() -> "Audio disabled; skipping " + pattern.name() + " tone");
    }
}
