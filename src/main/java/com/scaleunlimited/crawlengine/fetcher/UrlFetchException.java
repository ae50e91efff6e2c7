package com.scaleunlimited.crawlengine.fetcher;

@SuppressWarnings("serial")
public class UrlFetchException extends BaseFetchException {

    public UrlFetchException(String url, String msg) {
        super(url, msg);
    }

}
