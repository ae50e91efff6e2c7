package com.scaleunlimited.crawlengine.pojos;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable, per-attempt state that downloader middleware fills in before the
 * network call: outgoing headers, proxy, and anything a middleware wants to
 * hand to its own response phase.
 */
public class FetchContext {

    private final CrawlRequest _request;
    private final Map<String, String> _headers;
    private final Map<String, Object> _attributes;

    private String _proxy;
    private boolean _networkAttempted;

    public FetchContext(CrawlRequest request) {
        _request = request;
        _headers = new LinkedHashMap<>(request.getHeaders());
        _attributes = new HashMap<>();
        _proxy = null;
    }

    public CrawlRequest getRequest() {
        return _request;
    }

    public String getUrl() {
        return _request.getUrl();
    }

    public Map<String, String> getHeaders() {
        return _headers;
    }

    public FetchContext setHeader(String name, String value) {
        _headers.put(name, value);
        return this;
    }

    /**
     * Only sets the header if the request doesn't already carry one.
     */
    public FetchContext setDefaultHeader(String name, String value) {
        for (String existing : _headers.keySet()) {
            if (existing.equalsIgnoreCase(name)) {
                return this;
            }
        }

        _headers.put(name, value);
        return this;
    }

    public String getHeader(String name) {
        for (Map.Entry<String, String> entry : _headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }

        return null;
    }

    /**
     * @return proxy as "host:port", or null for a direct connection
     */
    public String getProxy() {
        return _proxy;
    }

    public void setProxy(String proxy) {
        _proxy = proxy;
    }

    /**
     * @return true once the downloader has started the network call, so
     *         response-phase middleware can tell real responses from short-circuits.
     */
    public boolean isNetworkAttempted() {
        return _networkAttempted;
    }

    public void setNetworkAttempted(boolean networkAttempted) {
        _networkAttempted = networkAttempted;
    }

    public Object getAttribute(String name) {
        return _attributes.get(name);
    }

    public void setAttribute(String name, Object value) {
        _attributes.put(name, value);
    }
}
