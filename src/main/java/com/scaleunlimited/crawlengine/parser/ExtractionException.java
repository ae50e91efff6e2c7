package com.scaleunlimited.crawlengine.parser;

/**
 * Thrown when a page can't be parsed, or an extractor fails on it. Only the one
 * page is affected.
 */
@SuppressWarnings("serial")
public class ExtractionException extends Exception {

    private final String _url;

    public ExtractionException(String url, String msg) {
        super(msg);
        _url = url;
    }

    public ExtractionException(String url, String msg, Throwable cause) {
        super(msg, cause);
        _url = url;
    }

    public String getUrl() {
        return _url;
    }

    @Override
    public String getMessage() {
        return String.format("%s (%s)", super.getMessage(), _url);
    }
}
