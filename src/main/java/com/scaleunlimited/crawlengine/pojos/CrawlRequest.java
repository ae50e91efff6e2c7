package com.scaleunlimited.crawlengine.pojos;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A single fetch target. Everything but the priority is fixed at construction
 * time; the priority belongs to the scheduler, which revises it while the
 * request waits in the frontier.
 */
@SuppressWarnings("serial")
public class CrawlRequest implements Serializable {

    public static final String DEFAULT_METHOD = "GET";

    private static final Map<String, String> NO_STRINGS = Collections.emptyMap();

    private final String _url;
    private final String _method;
    private final Map<String, String> _headers;
    private final byte[] _body;
    private final int _depth;
    private final Map<String, String> _metadata;
    private final int _retryCount;
    private final int _redirectCount;

    private volatile double _priority;

    public CrawlRequest(String url) {
        this(url, 0);
    }

    public CrawlRequest(String url, int depth) {
        this(url, DEFAULT_METHOD, NO_STRINGS, null, depth, NO_STRINGS, 0, 0);
    }

    public CrawlRequest(String url, String method, Map<String, String> headers, byte[] body,
            int depth, Map<String, String> metadata, int retryCount, int redirectCount) {
        if (url == null) {
            throw new IllegalArgumentException("URL can't be null");
        }

        if (depth < 0) {
            throw new IllegalArgumentException("Depth can't be negative: " + depth);
        }

        _url = url;
        _method = (method == null) ? DEFAULT_METHOD : method.toUpperCase(Locale.ROOT);
        _headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        _body = (body == null) ? null : Arrays.copyOf(body, body.length);
        _depth = depth;
        _metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        _retryCount = retryCount;
        _redirectCount = redirectCount;
    }

    /**
     * @param url absolute URL discovered on the page fetched for this request
     * @return new GET request one level deeper, carrying our metadata
     */
    public CrawlRequest makeChild(String url) {
        return new CrawlRequest(url, DEFAULT_METHOD, NO_STRINGS, null, _depth + 1, _metadata, 0, 0);
    }

    /**
     * Redirect targets stay at the depth of the request that was redirected.
     */
    public CrawlRequest makeRedirect(String url) {
        return new CrawlRequest(url, _method, _headers, _body, _depth, _metadata, 0,
                _redirectCount + 1);
    }

    public CrawlRequest makeRetry() {
        CrawlRequest result = new CrawlRequest(_url, _method, _headers, _body, _depth, _metadata,
                _retryCount + 1, _redirectCount);
        result.setPriority(_priority);
        return result;
    }

    public String getUrl() {
        return _url;
    }

    public String getMethod() {
        return _method;
    }

    public Map<String, String> getHeaders() {
        return _headers;
    }

    public byte[] getBody() {
        return _body;
    }

    public boolean hasBody() {
        return (_body != null) && (_body.length > 0);
    }

    public int getDepth() {
        return _depth;
    }

    public Map<String, String> getMetadata() {
        return _metadata;
    }

    public int getRetryCount() {
        return _retryCount;
    }

    public int getRedirectCount() {
        return _redirectCount;
    }

    public double getPriority() {
        return _priority;
    }

    public void setPriority(double priority) {
        _priority = priority;
    }

    @Override
    public String toString() {
        return String.format("%s %s (depth=%d, retries=%d, priority=%.2f)", _method, _url, _depth,
                _retryCount, _priority);
    }
}
