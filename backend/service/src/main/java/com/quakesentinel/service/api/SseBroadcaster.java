package com.quakesentinel.service.api;

import com.quakesentinel.core.bus.EventBus;
import com.quakesentinel.core.events.Event;
import com.quakesentinel.service.store.EventCodec;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Streams every monitor event to connected dashboards as server-sent events. Each frame carries an
 * increasing {@code id}; the connect preamble asks browsers to reconnect after {@link #RECONNECT_MILLIS}.
 * A dashboard whose socket fails on write is dropped.
 */
public class SseBroadcaster {
    private static final Logger LOGGER = Logger.getLogger(SseBroadcaster.class.getName());
    static final long RECONNECT_MILLIS = 3_000;

    private final Set<Dashboard> dashboards = ConcurrentHashMap.newKeySet();
    private final AtomicLong frameIds = new AtomicLong();
    private final long keepAliveMillis;

    public SseBroadcaster(EventBus eventBus) {
        this(eventBus, 15_000);
    }

    SseBroadcaster(EventBus eventBus, long keepAliveMillis) {
        this.keepAliveMillis = keepAliveMillis;
        EventCodec.subscribeAll(eventBus, this::broadcast);
    }

    /**
     * Holds the request thread for the life of the connection, writing keepalive comments.
     */
    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "GET");
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }
        Headers headers = exchange.getResponseHeaders();
        headers.set("Content-Type", "text/event-stream; charset=utf-8");
        headers.set("Cache-Control", "no-cache");
        headers.set("Connection", "keep-alive");
        headers.set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(200, 0);

        Dashboard dashboard = new Dashboard(exchange);
        dashboards.add(dashboard);
        try {
            dashboard.send(": connected\nretry: " + RECONNECT_MILLIS + "\n\n");
            while (!Thread.currentThread().isInterrupted()) {
                Thread.sleep(keepAliveMillis);
                dashboard.send(": keepalive\n\n");
            }
        } catch (IOException e) {
            LOGGER.fine(() -> "Dashboard " + dashboard.remote() + " went away");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            disconnect(dashboard);
        }
    }

    public void broadcast(Event event) {
        String frame = frame(frameIds.incrementAndGet(), event);
        for (Dashboard dashboard : dashboards) {
            try {
                dashboard.send(frame);
            } catch (IOException e) {
                LOGGER.fine(() -> "Dropping dashboard " + dashboard.remote() + ": " + e.getMessage());
                disconnect(dashboard);
            }
        }
    }

    public int clientCount() {
        return dashboards.size();
    }

    static String frame(long id, Event event) {
        return "id: " + id + "\nevent: " + event.type() + "\ndata: " + EventCodec.toSseData(event) + "\n\n";
    }

    private void disconnect(Dashboard dashboard) {
        if (dashboards.remove(dashboard)) {
            dashboard.close();
        }
    }

    private static final class Dashboard {
        private final HttpExchange exchange;
        private final OutputStream body;

        private Dashboard(HttpExchange exchange) {
            this.exchange = exchange;
            this.body = exchange.getResponseBody();
        }

        private synchronized void send(String text) throws IOException {
            body.write(text.getBytes(StandardCharsets.UTF_8));
            body.flush();
        }

        private String remote() {
            return String.valueOf(exchange.getRemoteAddress());
        }

        private void close() {
            try {
                body.close();
            } catch (IOException e) {
                LOGGER.fine("Event stream already closed");
            }
            exchange.close();
        }
    }
}
