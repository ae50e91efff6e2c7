package com.scaleunlimited.crawlengine.fetcher;

public class HttpClientFetcherBuilder extends BaseHttpFetcherBuilder {

    public HttpClientFetcherBuilder(int maxThreads) {
        super(maxThreads);
    }

    @Override
    public BaseHttpFetcher build() {
        return configure(new HttpClientFetcher(_maxThreads));
    }

}
