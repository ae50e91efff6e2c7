package com.scaleunlimited.crawlengine.downloader;

import com.scaleunlimited.crawlengine.pojos.FetchContext;
import com.scaleunlimited.crawlengine.pojos.FetchOutcome;

/**
 * One stage of the downloader's middleware chain. Request phases run in
 * chain order before the network call; response phases run in reverse order
 * afterwards, but only for stages whose request phase ran.
 */
public abstract class BaseDownloaderMiddleware {

    /**
     * @param context per-attempt state to modify (headers, proxy, ...)
     * @return null to continue, or an outcome that short-circuits the fetch
     *         without any network call.
     */
    public FetchOutcome processRequest(FetchContext context) {
        return null;
    }

    public void processResponse(FetchContext context, FetchOutcome outcome) {
    }

    public void close() {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
