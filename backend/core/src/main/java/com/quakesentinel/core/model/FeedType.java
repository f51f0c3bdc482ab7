package com.quakesentinel.core.model;

public enum FeedType {
    QUAKE("quakeFeed"),
    TSUNAMI("tsunamiFeed"),
    EEW("eewFeed");

    private final String collectorName;

    FeedType(String collectorName) {
        this.collectorName = collectorName;
    }

    public String collectorName() {
        return collectorName;
    }
}
