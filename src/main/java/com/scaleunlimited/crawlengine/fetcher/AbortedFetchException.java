package com.scaleunlimited.crawlengine.fetcher;

@SuppressWarnings("serial")
public class AbortedFetchException extends BaseFetchException {

    private final AbortedFetchReason _abortReason;

    public AbortedFetchException(String url, String msg, AbortedFetchReason abortReason) {
        super(url, msg);
        _abortReason = abortReason;
    }

    public AbortedFetchReason getAbortReason() {
        return _abortReason;
    }

}
