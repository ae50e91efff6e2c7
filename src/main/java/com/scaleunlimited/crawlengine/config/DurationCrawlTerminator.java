package com.scaleunlimited.crawlengine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts draining the crawl once it has run for a fixed wall-clock time.
 */
public class DurationCrawlTerminator extends CrawlTerminator {
    private static final Logger LOGGER = LoggerFactory.getLogger(DurationCrawlTerminator.class);

    private final long _maxDurationMs;

    private volatile long _deadline;
    private volatile boolean _expired;

    public DurationCrawlTerminator(int maxDurationSec) {
        if (maxDurationSec < 0) {
            throw new IllegalArgumentException("Crawl duration can't be negative: " + maxDurationSec);
        }

        _maxDurationMs = maxDurationSec * 1000L;
    }

    @Override
    public void open() {
        super.open();

        _deadline = System.currentTimeMillis() + _maxDurationMs;
        _expired = false;
        LOGGER.info("Crawl will stop after {}ms", _maxDurationMs);
    }

    /**
     * @return ms left before the crawl should drain, never negative
     */
    public long getRemainingMs() {
        return Math.max(0, _deadline - System.currentTimeMillis());
    }

    @Override
    public boolean isTerminated() {
        if (_expired) {
            return true;
        }

        if (getRemainingMs() > 0) {
            return false;
        }

        _expired = true;
        LOGGER.info("Crawl duration of {}ms has expired", _maxDurationMs);
        return true;
    }
}
