package com.scaleunlimited.crawlengine.fetcher;

import java.util.HashSet;
import java.util.Set;

public abstract class BaseHttpFetcherBuilder {

    protected int _maxThreads;
    protected int _maxContentSize = BaseHttpFetcher.DEFAULT_MAX_CONTENT_SIZE;
    protected int _timeoutMs = BaseHttpFetcher.DEFAULT_TIMEOUT_MS;
    protected int _maxConnectionsPerHost = BaseHttpFetcher.DEFAULT_MAX_CONNECTIONS_PER_HOST;
    protected Set<String> _validMimeTypes = new HashSet<String>();

    public BaseHttpFetcherBuilder(int maxThreads) {
        super();

        _maxThreads = maxThreads;
    }

    public BaseHttpFetcherBuilder setMaxContentSize(int maxContentSize) {
        _maxContentSize = maxContentSize;
        return this;
    }

    public BaseHttpFetcherBuilder setTimeoutMs(int timeoutMs) {
        _timeoutMs = timeoutMs;
        return this;
    }

    public BaseHttpFetcherBuilder setMaxConnectionsPerHost(int maxConnectionsPerHost) {
        _maxConnectionsPerHost = maxConnectionsPerHost;
        return this;
    }

    public BaseHttpFetcherBuilder setValidMimeTypes(Set<String> validMimeTypes) {
        _validMimeTypes = new HashSet<String>(validMimeTypes);
        return this;
    }

    public int getMaxThreads() {
        return _maxThreads;
    }

    /**
     * @return a new BaseHttpFetcher instance configured to match how this
     * builder was configured
     */
    public abstract BaseHttpFetcher build();

    /**
     * Helper method that {@link #build()} can use to configure a newly
     * constructed BaseHttpFetcher instance
     * 
     * @param fetcher instance of BaseHttpFetcher that {@link #build()} has
     * just constructed
     * @return the same fetcher, after applying all of the configuration
     * settings from this builder to that BaseHttpFetcher instance
     */
    protected BaseHttpFetcher configure(BaseHttpFetcher fetcher) {
        fetcher.setMaxContentSize(_maxContentSize);
        fetcher.setTimeoutMs(_timeoutMs);
        fetcher.setMaxConnectionsPerHost(_maxConnectionsPerHost);
        fetcher.setValidMimeTypes(_validMimeTypes);
        return fetcher;
    }
}
