package com.quakesentinel.service.audio;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;

public class JavaSoundToneOutput implements ToneOutput {
    static final int SAMPLE_RATE = 44_100;

    private final AudioFormat format = new AudioFormat(SAMPLE_RATE, 16, 1, true, false);

    @Override
    public void play(TonePattern pattern) {
        byte[] pcm = pattern.renderPcm16(SAMPLE_RATE);
        try (SourceDataLine line = AudioSystem.getSourceDataLine(format)) {
            line.open(format);
            line.start();
            line.write(pcm, 0, pcm.length);
            line.drain();
        } catch (LineUnavailableException e) {
            throw new IllegalStateException("No audio line available for pattern " + pattern.name(), e);
        }
    }
}
