package com.scaleunlimited.crawlengine.pojos;

/**
 * Something noteworthy (but never fatal) that happened during a crawl.
 */
public class CrawlEvent {

    public enum Type {
        ADMISSION_REJECTED,
        FETCH_SOFT,
        FETCH_RETRYABLE,
        FETCH_TERMINAL_FAILURE,
        EXTRACTION_FAILURE,
        SINK_FAILURE
    }

    private final Type _type;
    private final String _url;
    private final String _message;
    private final Throwable _cause;
    private final long _time;

    public CrawlEvent(Type type, String url, String message) {
        this(type, url, message, null);
    }

    public CrawlEvent(Type type, String url, String message, Throwable cause) {
        _type = type;
        _url = url;
        _message = message;
        _cause = cause;
        _time = System.currentTimeMillis();
    }

    public Type getType() {
        return _type;
    }

    public String getUrl() {
        return _url;
    }

    public String getMessage() {
        return _message;
    }

    public Throwable getCause() {
        return _cause;
    }

    public long getTime() {
        return _time;
    }

    @Override
    public String toString() {
        return String.format("%s %s: %s", _type, _url, _message);
    }
}
