package com.quakesentinel.core.events;

import java.time.Instant;

public record TestModeChanged(Instant timestamp, boolean active) implements Event {
    @Override
    public String type() {
        return "TestModeChanged";
    }
}
