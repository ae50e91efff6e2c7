package com.scaleunlimited.crawlengine.fetcher;

@SuppressWarnings("serial")
public abstract class BaseFetchException extends Exception {

    private final String _url;

    protected BaseFetchException(String url, String msg) {
        super(msg);
        _url = url;
    }

    protected BaseFetchException(String url, String msg, Throwable cause) {
        super(msg, cause);
        _url = url;
    }

    public String getUrl() {
        return _url;
    }

}
