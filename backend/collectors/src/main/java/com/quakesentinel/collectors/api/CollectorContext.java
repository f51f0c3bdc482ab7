package com.quakesentinel.collectors.api;

import com.quakesentinel.core.bus.EventBus;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

public record CollectorContext(
        EventBus eventBus,
        MonitorSink sink,
        Clock clock,
        Duration requestTimeout,
        Executor executor
) {
    public CollectorContext {
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(sink, "sink is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        Objects.requireNonNull(executor, "executor is required");
    }

    public CollectorContext withSink(MonitorSink replacement) {
        return new CollectorContext(eventBus, replacement, clock, requestTimeout, executor);
    }
}
