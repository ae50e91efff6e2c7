package com.scaleunlimited.crawlengine.fetcher;

import java.io.IOException;

@SuppressWarnings("serial")
public class TimeoutFetchException extends BaseFetchException {

    public TimeoutFetchException(String url, IOException e) {
        super(url, "Timeout fetching " + url + ": " + e.getMessage(), e);
    }

    public TimeoutFetchException(String url, String msg) {
        super(url, msg);
    }

}
