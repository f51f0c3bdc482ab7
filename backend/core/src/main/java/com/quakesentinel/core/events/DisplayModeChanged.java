package com.quakesentinel.core.events;

import com.quakesentinel.core.model.DisplayMode;

import java.time.Instant;

public record DisplayModeChanged(Instant timestamp, DisplayMode previous, DisplayMode current) implements Event {
    @Override
    public String type() {
        return "DisplayModeChanged";
    }
}
