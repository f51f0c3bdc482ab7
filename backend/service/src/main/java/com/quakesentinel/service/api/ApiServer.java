package com.quakesentinel.service.api;

import com.quakesentinel.core.bus.EventBus;
import com.quakesentinel.core.events.SyncRequested;
import com.quakesentinel.core.util.JsonUtils;
import com.quakesentinel.service.runtime.AlertMonitor;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/**
 * Dashboard-facing HTTP surface: monitor snapshot, refresh, test mode, force sync, diagnostics and the
 * event stream.
 */
public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());

    private final int port;
    private final AlertMonitor monitor;
    private final EventBus eventBus;
    private final SseBroadcaster sseBroadcaster;
    private final DiagnosticsTracker diagnosticsTracker;
    private final Clock clock;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            AlertMonitor monitor,
            EventBus eventBus,
            SseBroadcaster sseBroadcaster,
            DiagnosticsTracker diagnosticsTracker,
            Clock clock
    ) {
        this.port = port;
        this.monitor = monitor;
        this.eventBus = eventBus;
        this.sseBroadcaster = sseBroadcaster;
        this.diagnosticsTracker = diagnosticsTracker;
        this.clock = clock;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newCachedThreadPool(runnable -> {
                Thread thread = new Thread(runnable, "api-http");
                thread.setDaemon(true);
                return thread;
            });
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/alerts", this::handleAlerts);
            server.createContext("/api/alerts/refresh", this::handleRefresh);
            server.createContext("/api/alerts/test", this::handleTestMode);
            server.createContext("/api/sync", this::handleSync);
            server.createContext("/api/feeds/status", this::handleFeedStatus);
            server.createContext("/api/metrics", this::handleMetrics);
            server.createContext("/api/stream", sseBroadcaster::handle);
            server.start();
            LOGGER.info("API listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("GET"))) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleAlerts(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("GET"))) {
            return;
        }
        if (!"/api/alerts".equals(exchange.getRequestURI().getPath())) {
            writeJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        writeJson(exchange, 200, monitor.snapshot());
    }

    private void handleRefresh(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("POST"))) {
            return;
        }
        writeJson(exchange, 200, monitor.manualRefresh());
    }

    private void handleTestMode(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("POST", "DELETE"))) {
            return;
        }
        if ("POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            monitor.enterTest();
        } else {
            monitor.exitTest();
        }
        writeJson(exchange, 200, monitor.snapshot());
    }

    private void handleSync(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("POST"))) {
            return;
        }
        eventBus.publish(new SyncRequested(clock.instant(), "api"));
        writeJson(exchange, 202, Map.of("status", "sync_requested"));
    }

    private void handleFeedStatus(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("GET"))) {
            return;
        }
        writeJson(exchange, 200, diagnosticsTracker.feedsSnapshot());
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("GET"))) {
            return;
        }
        writeJson(exchange, 200, diagnosticsTracker.metricsSnapshot());
    }

    private boolean ensureMethod(HttpExchange exchange, Set<String> allowed) throws IOException {
        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        if ("OPTIONS".equals(method)) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", String.join(",", allowed) + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!allowed.contains(method)) {
            exchange.getResponseHeaders().set("Allow", String.join(",", allowed));
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.toJsonBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }
}
