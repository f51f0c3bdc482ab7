package com.quakesentinel.core.events;

import java.time.Instant;

public record PollCadenceChanged(Instant timestamp, long previousMillis, long currentMillis) implements Event {
    @Override
    public String type() {
        return "PollCadenceChanged";
    }
}
