package com.quakesentinel.service.audio;

/**
 * Platform audio primitive. Implementations may block until the pattern has finished playing and
 * may throw when no audio device is available.
 */
public interface ToneOutput extends AutoCloseable {
    void play(TonePattern pattern);

    @Override
    default void close() {
    }
}
