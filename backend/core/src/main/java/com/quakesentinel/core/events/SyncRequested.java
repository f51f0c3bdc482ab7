package com.quakesentinel.core.events;

import java.time.Instant;

/**
 * Dashboard-wide "force sync" signal. Every widget that polls something re-polls on receipt.
 */
public record SyncRequested(Instant timestamp, String origin) implements Event {
    @Override
    public String type() {
        return "SyncRequested";
    }
}
