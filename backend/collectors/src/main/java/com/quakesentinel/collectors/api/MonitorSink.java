package com.quakesentinel.collectors.api;

import com.quakesentinel.core.model.NormalizedEvent;

/**
 * Receives parsed, classified events from collectors.
 */
@FunctionalInterface
public interface MonitorSink {
    void deliver(NormalizedEvent event);
}
