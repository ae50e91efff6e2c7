package com.scaleunlimited.crawlengine.downloader;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.crawlengine.config.CrawlSettings;
import com.scaleunlimited.crawlengine.fetcher.AbortedFetchException;
import com.scaleunlimited.crawlengine.fetcher.AbortedFetchReason;
import com.scaleunlimited.crawlengine.fetcher.BaseFetchException;
import com.scaleunlimited.crawlengine.fetcher.BaseHttpFetcher;
import com.scaleunlimited.crawlengine.pojos.CrawlRequest;
import com.scaleunlimited.crawlengine.pojos.FetchContext;
import com.scaleunlimited.crawlengine.pojos.FetchOutcome;
import com.scaleunlimited.crawlengine.pojos.FetchedResponse;
import com.scaleunlimited.crawlengine.pojos.ResponseStatus;
import com.scaleunlimited.crawlengine.utils.ExceptionUtils;
import com.scaleunlimited.crawlengine.utils.HttpUtils;
import com.scaleunlimited.crawlengine.utils.UrlLogger;

/**
 * Turns one request into one {@link FetchOutcome}: middleware request phase,
 * the network call, classification, then middleware response phase. Per-request
 * failures never escape as exceptions.
 */
public class Downloader {
    static final Logger LOGGER = LoggerFactory.getLogger(Downloader.class);

    private final BaseHttpFetcher _fetcher;
    private final List<BaseDownloaderMiddleware> _middleware;
    private final RetryPolicy _retryPolicy;
    private final int _maxRedirects;

    public Downloader(BaseHttpFetcher fetcher, List<BaseDownloaderMiddleware> middleware, CrawlSettings settings) {
        this(fetcher, middleware, new RetryPolicy(settings), settings.getMaxRedirects());
    }

    public Downloader(BaseHttpFetcher fetcher, List<BaseDownloaderMiddleware> middleware,
            RetryPolicy retryPolicy, int maxRedirects) {
        _fetcher = fetcher;
        _middleware = Collections.unmodifiableList(new ArrayList<>(middleware));
        _retryPolicy = retryPolicy;
        _maxRedirects = maxRedirects;
    }

    public FetchOutcome fetch(CrawlRequest request) {
        FetchContext context = new FetchContext(request);
        List<BaseDownloaderMiddleware> processed = new ArrayList<>(_middleware.size());

        FetchOutcome outcome = null;
        for (BaseDownloaderMiddleware middleware : _middleware) {
            processed.add(middleware);

            try {
                outcome = middleware.processRequest(context);
            } catch (RuntimeException e) {
                LOGGER.error(String.format("Middleware %s failed on '%s'", middleware, request.getUrl()), e);
                outcome = FetchOutcome.terminalFailure(ResponseStatus.CLIENT_ERROR, null, 0,
                        "Middleware failure: " + e.getMessage());
            }

            if (outcome != null) {
                LOGGER.debug("Fetch of '{}' short-circuited by {}: {}", request.getUrl(), middleware, outcome);
                break;
            }
        }

        if (outcome == null) {
            outcome = doFetch(context);
        }

        for (int i = processed.size() - 1; i >= 0; i--) {
            BaseDownloaderMiddleware middleware = processed.get(i);
            try {
                middleware.processResponse(context, outcome);
            } catch (RuntimeException e) {
                LOGGER.error(String.format("Middleware %s failed on response for '%s'", middleware, request.getUrl()), e);
            }
        }

        UrlLogger.record(Downloader.class, request, "outcome", outcome.getKind().name(), "status",
                outcome.getStatus().name());
        return outcome;
    }

    private FetchOutcome doFetch(FetchContext context) {
        CrawlRequest request = context.getRequest();
        context.setNetworkAttempted(true);

        LOGGER.debug("Fetching {}", request);
        long startTime = System.currentTimeMillis();
        try {
            FetchedResponse response = _fetcher.get(context);
            return classify(response);
        } catch (BaseFetchException e) {
            long latency = System.currentTimeMillis() - startTime;
            ResponseStatus status = ExceptionUtils.mapExceptionToResponseStatus(e);
            LOGGER.trace("Failed to fetch '{}' due to {}", request.getUrl(), e.getMessage());

            if ((e instanceof AbortedFetchException)
                    && (((AbortedFetchException) e).getAbortReason() == AbortedFetchReason.INTERRUPTED)) {
                return FetchOutcome.terminalFailure(status, null, latency, "Fetch cancelled");
            } else if (status.isServerSideError()) {
                return _retryPolicy.onRetryableFailure(request, status, null, latency, e.getMessage());
            } else {
                return FetchOutcome.softFailure(status, null, e.getMessage());
            }
        }
    }

    /**
     * Map a response to an outcome by status code.
     */
    protected FetchOutcome classify(FetchedResponse response) {
        int statusCode = response.getStatusCode();
        ResponseStatus status = ExceptionUtils.mapHttpStatusToResponseStatus(statusCode);
        response.setStatus(status);

        if ((statusCode >= 200) && (statusCode < 300)) {
            return FetchOutcome.success(response);
        } else if ((statusCode >= 300) && (statusCode < 400)) {
            return classifyRedirect(response);
        } else if (status == ResponseStatus.CLIENT_ERROR) {
            return FetchOutcome.softFailure(status, response, "HTTP status " + statusCode);
        } else if (status.isServerSideError()) {
            return _retryPolicy.onRetryableFailure(response.getRequest(), status, response,
                    response.getLatencyMs(), "HTTP status " + statusCode);
        } else {
            return FetchOutcome.softFailure(status, response, "Unexpected HTTP status " + statusCode);
        }
    }

    private FetchOutcome classifyRedirect(FetchedResponse response) {
        CrawlRequest request = response.getRequest();
        String location = response.getHeader(HttpUtils.LOCATION);
        if (location == null) {
            return FetchOutcome.softFailure(ResponseStatus.OK, response,
                    "Redirect without location (" + response.getStatusCode() + ")");
        }

        if (request.getRedirectCount() >= _maxRedirects) {
            return FetchOutcome.softFailure(ResponseStatus.OK, response,
                    String.format("Too many redirects (%d)", request.getRedirectCount()));
        }

        String redirectUrl;
        try {
            redirectUrl = new URL(new URL(request.getUrl()), location.trim()).toExternalForm();
        } catch (MalformedURLException e) {
            return FetchOutcome.softFailure(ResponseStatus.OK, response, "Invalid redirect location: " + location);
        }

        return FetchOutcome.redirect(response, redirectUrl);
    }

    /**
     * Abort any fetches currently in progress.
     */
    public void abort() {
        _fetcher.abort();
    }

    public void close() {
        for (BaseDownloaderMiddleware middleware : _middleware) {
            middleware.close();
        }

        _fetcher.close();
    }

    public List<BaseDownloaderMiddleware> getMiddleware() {
        return _middleware;
    }
}
