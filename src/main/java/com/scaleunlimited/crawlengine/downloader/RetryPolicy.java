package com.scaleunlimited.crawlengine.downloader;

import com.scaleunlimited.crawlengine.config.CrawlSettings;
import com.scaleunlimited.crawlengine.pojos.CrawlRequest;
import com.scaleunlimited.crawlengine.pojos.FetchOutcome;
import com.scaleunlimited.crawlengine.pojos.FetchedResponse;
import com.scaleunlimited.crawlengine.pojos.ResponseStatus;

/**
 * Capped exponential backoff for retryable failures. A request is fetched at
 * most retryCap + 1 times; the delay before retry n (0-based) is
 * min(backoffMax, backoffBase * 2^n).
 */
public class RetryPolicy {

    private final int _retryCap;
    private final long _backoffBaseMs;
    private final long _backoffMaxMs;

    public RetryPolicy(CrawlSettings settings) {
        this(settings.getRetryCap(), settings.getBackoffBaseMs(), settings.getBackoffMaxMs());
    }

    public RetryPolicy(int retryCap, long backoffBaseMs, long backoffMaxMs) {
        _retryCap = retryCap;
        _backoffBaseMs = backoffBaseMs;
        _backoffMaxMs = backoffMaxMs;
    }

    public long getRetryDelay(int retryCount) {
        if (retryCount >= 30) {
            return _backoffMaxMs;
        }

        return Math.min(_backoffMaxMs, _backoffBaseMs * (1L << retryCount));
    }

    public FetchOutcome onRetryableFailure(CrawlRequest request, ResponseStatus status,
            FetchedResponse response, long latencyMs, String reason) {
        int retryCount = request.getRetryCount();
        if (retryCount < _retryCap) {
            return FetchOutcome.retry(status, response, getRetryDelay(retryCount), latencyMs, reason);
        } else {
            return FetchOutcome.terminalFailure(status, response, latencyMs,
                    String.format("Giving up after %d retries: %s", retryCount, reason));
        }
    }

    public int getRetryCap() {
        return _retryCap;
    }
}
