package com.quakesentinel.service.api;

/**
 * Passive per-feed health shown on the dashboard.
 */
public enum FeedSignal {
    UNKNOWN,
    OK,
    NO_SIGNAL
}
