package com.scaleunlimited.crawlengine.engine;

/**
 * The crawl was stopped by an unrecoverable error, e.g. a critical sink that
 * failed.
 */
@SuppressWarnings("serial")
public class CrawlException extends Exception {

    private final CrawlSummary _summary;

    public CrawlException(String msg, Throwable cause, CrawlSummary summary) {
        super(msg, cause);
        _summary = summary;
    }

    /**
     * @return what the crawl got done before it failed
     */
    public CrawlSummary getSummary() {
        return _summary;
    }
}
