package com.scaleunlimited.crawlengine.engine;

import com.scaleunlimited.crawlengine.pojos.CrawlEvent;

/**
 * Gets crawl-level events. Called from fetch threads, so implementations must
 * be thread-safe and quick.
 */
public interface CrawlEventListener {

    void onEvent(CrawlEvent event);
}
