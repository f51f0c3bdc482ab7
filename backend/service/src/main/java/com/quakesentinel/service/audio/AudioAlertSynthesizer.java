package com.quakesentinel.service.audio;

import com.quakesentinel.core.model.AlertClass;

/**
 * Fire-and-forget alert tones. {@link #play} returns immediately and never throws.
 */
public interface AudioAlertSynthesizer extends AutoCloseable {
    void play(AlertClass alertClass);

    @Override
    void close();
}
