package com.scaleunlimited.crawlengine.engine;

public enum CrawlState {
    IDLE,
    RUNNING,

    // No new dispatches, waiting for in-flight fetches.
    DRAINING,

    // In-flight fetches are being cancelled.
    CANCELLING,

    STOPPED;

    public boolean isActive() {
        return (this == RUNNING) || (this == DRAINING) || (this == CANCELLING);
    }
}
