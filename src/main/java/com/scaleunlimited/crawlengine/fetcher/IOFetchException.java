package com.scaleunlimited.crawlengine.fetcher;

import java.io.IOException;

@SuppressWarnings("serial")
public class IOFetchException extends BaseFetchException {

    public IOFetchException(String url, IOException e) {
        super(url, "I/O error fetching " + url + ": " + e.getMessage(), e);
    }

}
