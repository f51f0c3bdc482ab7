package com.quakesentinel.service.audio;

import com.quakesentinel.core.model.AlertClass;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Plays alert patterns on one background thread. At most {@link #QUEUE_CAPACITY} patterns wait behind
 * the one playing; older waiting patterns are dropped in favour of newer ones.
 */
public class ToneAlertSynthesizer implements AudioAlertSynthesizer {
    private static final Logger LOGGER = Logger.getLogger(ToneAlertSynthesizer.class.getName());
    static final int QUEUE_CAPACITY = 2;

    private final ToneOutput output;
    private final ThreadPoolExecutor worker;

    public ToneAlertSynthesizer(ToneOutput output) {
        this.output = output;
        this.worker = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(QUEUE_CAPACITY),
                daemonThreads(),
                new ThreadPoolExecutor.DiscardOldestPolicy()
        );
    }

    @Override
    public void play(AlertClass alertClass) {
        if (alertClass == null || worker.isShutdown()) {
            return;
        }
        TonePattern pattern = AlertTonePatterns.forClass(alertClass);
        worker.execute(() -> render(pattern));
    }

    @Override
    public void close() {
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(2, TimeUnit.SECONDS)) {
                LOGGER.warning("Alert audio worker did not stop within 2s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            output.close();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed releasing audio output", e);
        }
    }

    int pendingCount() {
        return worker.getQueue().size();
    }

    private void render(TonePattern pattern) {
        try {
            output.play(pattern);
        } catch (RuntimeException | LinkageError e) {
            LOGGER.log(Level.WARNING, "Alert tone playback failed for pattern " + pattern.name(), e);
        }
    }

    private static ThreadFactory daemonThreads() {
        return runnable -> {
            Thread thread = new Thread(runnable, "alert-audio");
            thread.setDaemon(true);
            return thread;
        };
    }
}
