package com.quakesentinel.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quakesentinel.core.bus.EventBus;
import com.quakesentinel.core.events.AlertRaised;
import com.quakesentinel.core.events.CollectorTickCompleted;
import com.quakesentinel.core.events.CollectorTickStarted;
import com.quakesentinel.core.events.DisplayModeChanged;
import com.quakesentinel.core.events.Event;
import com.quakesentinel.core.events.MonitorUpdated;
import com.quakesentinel.core.events.PollCadenceChanged;
import com.quakesentinel.core.events.SyncRequested;
import com.quakesentinel.core.events.TestModeChanged;
import com.quakesentinel.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * JSON envelope {@code {"type", "timestamp", "event"}} for bus events sent over the stream endpoint.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = types();

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toSseData(Event event) {
        try {
            return MAPPER.writeValueAsString(new EncodedEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize SSE event", e);
        }
    }

    public static Event fromSseData(String data) {
        try {
            JsonNode node = MAPPER.readTree(data);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        for (Class<? extends Event> type : TYPES.values()) {
            subscribe(bus, type, consumer);
        }
    }

    private static <T extends Event> void subscribe(EventBus bus, Class<T> type, Consumer<Event> consumer) {
        bus.subscribe(type, consumer::accept);
    }

    private static Map<String, Class<? extends Event>> types() {
        Map<String, Class<? extends Event>> types = new LinkedHashMap<>();
        types.put("CollectorTickStarted", CollectorTickStarted.class);
        types.put("CollectorTickCompleted", CollectorTickCompleted.class);
        types.put("AlertRaised", AlertRaised.class);
        types.put("MonitorUpdated", MonitorUpdated.class);
        types.put("DisplayModeChanged", DisplayModeChanged.class);
        types.put("PollCadenceChanged", PollCadenceChanged.class);
        types.put("TestModeChanged", TestModeChanged.class);
        types.put("SyncRequested", SyncRequested.class);
        return Map.copyOf(types);
    }

    private record EncodedEvent(String type, Instant timestamp, Event event) {
    }
}
