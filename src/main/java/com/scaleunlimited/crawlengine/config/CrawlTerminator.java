package com.scaleunlimited.crawlengine.config;

/**
 * Decides when a running crawl should start draining, independent of the
 * frontier running dry.
 */
public abstract class CrawlTerminator {

    /**
     * Called once, when the crawl starts.
     */
    public void open() {

    }

    public abstract boolean isTerminated();
}
