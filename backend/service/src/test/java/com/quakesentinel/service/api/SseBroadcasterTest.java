package com.quakesentinel.service.api;

import com.quakesentinel.core.bus.EventBus;
import com.quakesentinel.core.events.DisplayModeChanged;
import com.quakesentinel.core.model.DisplayMode;
import com.quakesentinel.service.support.TestBuses;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpPrincipal;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SseBroadcasterTest {
    @Test
    void handleReturnsPromptlyWhenThreadAlreadyInterrupted() throws Exception {
        SseBroadcaster broadcaster = new SseBroadcaster(TestBuses.failingOnHandlerError());
        FakeHttpExchange exchange = new FakeHttpExchange("GET", URI.create("/api/stream"));

        try {
            Thread.currentThread().interrupt();
            broadcaster.handle(exchange);
        } finally {
            Thread.interrupted();
        }

        assertEquals(200, exchange.responseCode);
        assertTrue(exchange.responseHeaders.getFirst("Content-Type").contains("text/event-stream"));
        assertTrue(exchange.body().startsWith(": connected"));
        assertTrue(exchange.body().contains("retry: " + SseBroadcaster.RECONNECT_MILLIS + "\n"));
        assertEquals(0, broadcaster.clientCount());
    }

    @Test
    void framesCarryIdEventNameAndJsonData() {
        DisplayModeChanged event = new DisplayModeChanged(Instant.parse("2026-02-09T20:00:00Z"), DisplayMode.SEISMIC, DisplayMode.EEW);

        String frame = SseBroadcaster.frame(7, event);

        assertTrue(frame.startsWith("id: 7\nevent: DisplayModeChanged\ndata: {"));
        assertTrue(frame.endsWith("}\n\n"));
    }

    @Test
    void rejectsNonGetRequests() throws Exception {
        SseBroadcaster broadcaster = new SseBroadcaster(TestBuses.failingOnHandlerError());
        FakeHttpExchange exchange = new FakeHttpExchange("POST", URI.create("/api/stream"));

        broadcaster.handle(exchange);

        assertEquals(405, exchange.responseCode);
        assertEquals(0, broadcaster.clientCount());
    }

    @Test
    void connectedClientReceivesBusEventsUntilInterrupted() throws Exception {
        EventBus eventBus = TestBuses.failingOnHandlerError();
        SseBroadcaster broadcaster = new SseBroadcaster(eventBus, 20);
        FakeHttpExchange exchange = new FakeHttpExchange("GET", URI.create("/api/stream"));
        Thread client = new Thread(() -> {
            try {
                broadcaster.handle(exchange);
            } catch (Exception e) {
                throw new AssertionError(e);
            }
        }, "sse-test-client");
        client.start();
        waitFor(() -> broadcaster.clientCount() == 1);

        eventBus.publish(new DisplayModeChanged(Instant.parse("2026-02-09T20:00:00Z"), DisplayMode.SEISMIC, DisplayMode.EEW));
        waitFor(() -> exchange.body().contains(": keepalive"));

        client.interrupt();
        client.join(2_000);

        assertFalse(client.isAlive());
        assertEquals(0, broadcaster.clientCount());
        String body = exchange.body();
        assertTrue(body.contains("event: DisplayModeChanged\n"));
        assertTrue(body.contains("\"current\":\"EEW\""));
        assertTrue(body.contains("id: 1\nevent: DisplayModeChanged\n"));
    }

    @Test
    void subsequentEventsGetIncreasingIds() throws Exception {
        EventBus eventBus = TestBuses.failingOnHandlerError();
        SseBroadcaster broadcaster = new SseBroadcaster(eventBus, 20);
        FakeHttpExchange exchange = new FakeHttpExchange("GET", URI.create("/api/stream"));
        Thread client = new Thread(() -> {
            try {
                broadcaster.handle(exchange);
            } catch (Exception e) {
                throw new AssertionError(e);
            }
        }, "sse-test-client");
        client.start();
        waitFor(() -> broadcaster.clientCount() == 1);

        Instant at = Instant.parse("2026-02-09T20:00:00Z");
        eventBus.publish(new DisplayModeChanged(at, DisplayMode.SEISMIC, DisplayMode.EEW));
        eventBus.publish(new DisplayModeChanged(at, DisplayMode.EEW, DisplayMode.SEISMIC));
        waitFor(() -> exchange.body().contains("id: 2\n"));

        client.interrupt();
        client.join(2_000);

        String body = exchange.body();
        assertTrue(body.indexOf("id: 1\n") < body.indexOf("id: 2\n"));
        assertTrue(body.contains("\"current\":\"SEISMIC\""));
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
        while (System.nanoTime() < deadline && !condition.getAsBoolean()) {
            Thread.sleep(10);
        }
    }

    private static final class FakeHttpExchange extends HttpExchange {
        private final Headers requestHeaders = new Headers();
        private final Headers responseHeaders = new Headers();
        private final String method;
        private final URI uri;
        private final ByteArrayOutputStream responseBody = new ByteArrayOutputStream();
        private volatile int responseCode = -1;

        private FakeHttpExchange(String method, URI uri) {
            this.method = method;
            this.uri = uri;
        }

        String body() {
            return responseBody.toString(StandardCharsets.UTF_8);
        }

        @Override
        public Headers getRequestHeaders() {
            return requestHeaders;
        }

        @Override
        public Headers getResponseHeaders() {
            return responseHeaders;
        }

        @Override
        public URI getRequestURI() {
            return uri;
        }

        @Override
        public String getRequestMethod() {
            return method;
        }

        @Override
        public HttpContext getHttpContext() {
            return null;
        }

        @Override
        public void close() {
        }

        @Override
        public InputStream getRequestBody() {
            return new ByteArrayInputStream(new byte[0]);
        }

        @Override
        public OutputStream getResponseBody() {
            return responseBody;
        }

        @Override
        public void sendResponseHeaders(int rCode, long responseLength) {
            this.responseCode = rCode;
        }

        @Override
        public InetSocketAddress getRemoteAddress() {
            return new InetSocketAddress("127.0.0.1", 12345);
        }

        @Override
        public int getResponseCode() {
            return responseCode;
        }

        @Override
        public InetSocketAddress getLocalAddress() {
            return new InetSocketAddress("127.0.0.1", 8080);
        }

        @Override
        public String getProtocol() {
            return "HTTP/1.1";
        }

        @Override
        public Object getAttribute(String name) {
            return null;
        }

        @Override
        public void setAttribute(String name, Object value) {
        }

        @Override
        public void setStreams(InputStream i, OutputStream o) {
            throw new UnsupportedOperationException("not needed in tests");
        }

        @Override
        public HttpPrincipal getPrincipal() {
            return null;
        }
    }
}
