package com.scaleunlimited.crawlengine.fetcher;

import java.util.HashSet;
import java.util.Set;

import com.scaleunlimited.crawlengine.pojos.FetchContext;
import com.scaleunlimited.crawlengine.pojos.FetchedResponse;

/**
 * Executes exactly one HTTP exchange. Redirects are never followed here; a
 * 3xx is returned like any other response, and error status codes are not
 * exceptions. Only failures to get a response at all are thrown.
 */
public abstract class BaseHttpFetcher {

    public static final int DEFAULT_MAX_CONTENT_SIZE = 1024 * 1024;
    public static final int DEFAULT_TIMEOUT_MS = 30 * 1000;
    public static final int DEFAULT_MAX_CONNECTIONS_PER_HOST = 2;

    protected int _maxThreads;
    protected int _maxContentSize = DEFAULT_MAX_CONTENT_SIZE;
    protected int _timeoutMs = DEFAULT_TIMEOUT_MS;
    protected int _maxConnectionsPerHost = DEFAULT_MAX_CONNECTIONS_PER_HOST;
    protected Set<String> _validMimeTypes = new HashSet<>();

    public BaseHttpFetcher(int maxThreads) {
        _maxThreads = maxThreads;
    }

    public abstract FetchedResponse get(FetchContext context) throws BaseFetchException;

    /**
     * Abort any fetches that are in progress. Threads blocked in
     * {@link #get(FetchContext)} will get an {@link AbortedFetchException}.
     */
    public abstract void abort();

    /**
     * Release resources (connection pools and such).
     */
    public void close() {
    }

    public int getMaxThreads() {
        return _maxThreads;
    }

    public int getMaxContentSize() {
        return _maxContentSize;
    }

    public void setMaxContentSize(int maxContentSize) {
        _maxContentSize = maxContentSize;
    }

    public int getTimeoutMs() {
        return _timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        _timeoutMs = timeoutMs;
    }

    public int getMaxConnectionsPerHost() {
        return _maxConnectionsPerHost;
    }

    public void setMaxConnectionsPerHost(int maxConnectionsPerHost) {
        _maxConnectionsPerHost = maxConnectionsPerHost;
    }

    public Set<String> getValidMimeTypes() {
        return _validMimeTypes;
    }

    public void setValidMimeTypes(Set<String> validMimeTypes) {
        _validMimeTypes = new HashSet<>(validMimeTypes);
    }

    protected boolean isValidMimeType(String mimeType) {
        return _validMimeTypes.isEmpty() || _validMimeTypes.contains(mimeType);
    }
}
