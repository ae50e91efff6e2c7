package com.scaleunlimited.crawlengine.fetcher;

public enum AbortedFetchReason {
    INTERRUPTED,
    CONTENT_SIZE,
    INVALID_MIMETYPE
}
