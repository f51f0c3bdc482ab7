package com.quakesentinel.service;

import com.quakesentinel.collectors.p2pquake.P2pQuakeClient;
import com.quakesentinel.core.bus.EventBus;
import com.quakesentinel.service.api.ApiServer;
import com.quakesentinel.service.api.DiagnosticsTracker;
import com.quakesentinel.service.api.SseBroadcaster;
import com.quakesentinel.service.audio.AudioAlertSynthesizer;
import com.quakesentinel.service.audio.JavaSoundToneOutput;
import com.quakesentinel.service.audio.SilentToneOutput;
import com.quakesentinel.service.audio.ToneAlertSynthesizer;
import com.quakesentinel.service.config.ConfigLoader;
import com.quakesentinel.service.config.MonitorConfig;
import com.quakesentinel.service.runtime.AlertMonitor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = ConfigLoader.resolveConfigDir(System.getenv());
        MonitorConfig config = ConfigLoader.load(configDir);
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        P2pQuakeClient feedClient = new P2pQuakeClient(P2pQuakeClient.newHttpClient(config.feeds()), config.feeds());
        AudioAlertSynthesizer audio = new ToneAlertSynthesizer(
                config.audio().enabled() ? new JavaSoundToneOutput() : new SilentToneOutput()
        );
        AlertMonitor monitor = AlertMonitor.create(config, feedClient, audio, eventBus, clock);

        ApiServer apiServer = null;
        if (config.api().enabled()) {
            SseBroadcaster broadcaster = new SseBroadcaster(eventBus);
            DiagnosticsTracker diagnostics = new DiagnosticsTracker(eventBus, clock, broadcaster::clientCount);
            apiServer = new ApiServer(config.api().port(), monitor, eventBus, broadcaster, diagnostics, clock);
        } else {
            LOGGER.info("api.enabled=false; dashboard API is disabled.");
        }

        monitor.start();
        if (apiServer != null) {
            apiServer.start();
        }

        ApiServer startedApi = apiServer;
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (startedApi != null) {
                startedApi.stop();
            }
            monitor.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed reading bundled logging.properties", e);
        }
    }
}
