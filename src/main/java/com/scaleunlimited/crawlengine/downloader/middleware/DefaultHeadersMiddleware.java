package com.scaleunlimited.crawlengine.downloader.middleware;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.scaleunlimited.crawlengine.downloader.BaseDownloaderMiddleware;
import com.scaleunlimited.crawlengine.pojos.FetchContext;
import com.scaleunlimited.crawlengine.pojos.FetchOutcome;
import com.scaleunlimited.crawlengine.utils.HttpUtils;

/**
 * Adds headers that every request should carry, unless the request sets
 * its own value.
 */
public class DefaultHeadersMiddleware extends BaseDownloaderMiddleware {

    public static final String DEFAULT_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    public static final String DEFAULT_ACCEPT_LANGUAGE = "en-us,en-gb,en;q=0.7,*;q=0.3";

    private final Map<String, String> _headers;

    public DefaultHeadersMiddleware() {
        this(makeDefaultHeaders());
    }

    public DefaultHeadersMiddleware(Map<String, String> headers) {
        _headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    @Override
    public FetchOutcome processRequest(FetchContext context) {
        for (Map.Entry<String, String> header : _headers.entrySet()) {
            context.setDefaultHeader(header.getKey(), header.getValue());
        }

        return null;
    }

    public Map<String, String> getHeaders() {
        return _headers;
    }

    private static Map<String, String> makeDefaultHeaders() {
        Map<String, String> result = new LinkedHashMap<>();
        result.put(HttpUtils.ACCEPT, DEFAULT_ACCEPT);
        result.put(HttpUtils.ACCEPT_LANGUAGE, DEFAULT_ACCEPT_LANGUAGE);
        return result;
    }
}
