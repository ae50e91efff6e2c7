package com.scaleunlimited.crawlengine.downloader.middleware;

import com.scaleunlimited.crawlengine.downloader.BaseDownloaderMiddleware;
import com.scaleunlimited.crawlengine.pojos.FetchContext;
import com.scaleunlimited.crawlengine.pojos.FetchOutcome;
import com.scaleunlimited.crawlengine.throttle.AutoThrottle;
import com.scaleunlimited.crawlengine.urls.UrlUtils;

/**
 * Feeds the latency and classification of every real network attempt into
 * the {@link AutoThrottle}. Short-circuited requests never reached the host,
 * so they're ignored.
 */
public class AutoThrottleMiddleware extends BaseDownloaderMiddleware {

    private final AutoThrottle _autoThrottle;

    public AutoThrottleMiddleware(AutoThrottle autoThrottle) {
        _autoThrottle = autoThrottle;
    }

    @Override
    public void processResponse(FetchContext context, FetchOutcome outcome) {
        if (!context.isNetworkAttempted()) {
            return;
        }

        String host = UrlUtils.getHostKey(context.getUrl());
        _autoThrottle.record(host, outcome.getStatus(), outcome.getHttpStatus(), outcome.getLatencyMs());
    }
}
