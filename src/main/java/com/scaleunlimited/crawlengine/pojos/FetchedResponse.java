package com.scaleunlimited.crawlengine.pojos;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

@SuppressWarnings("serial")
public class FetchedResponse implements Serializable {

    private static final byte[] NO_CONTENT = new byte[0];

    private final CrawlRequest _request;
    private final int _statusCode;
    private final Map<String, String> _headers;
    private final byte[] _content;
    private final String _contentType;
    private final long _latencyMs;
    private final long _fetchTime;

    private ResponseStatus _status;

    public FetchedResponse(CrawlRequest request, int statusCode, Map<String, String> headers,
            byte[] content, String contentType, long latencyMs, long fetchTime) {
        _request = request;
        _statusCode = statusCode;

        // Header names are case-insensitive.
        TreeMap<String, String> normalized = new TreeMap<>();
        if (headers != null) {
            for (Map.Entry<String, String> entry : headers.entrySet()) {
                normalized.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
            }
        }
        _headers = Collections.unmodifiableMap(normalized);

        _content = (content == null) ? NO_CONTENT : content;
        _contentType = (contentType == null) ? "" : contentType;
        _latencyMs = latencyMs;
        _fetchTime = fetchTime;
    }

    public CrawlRequest getRequest() {
        return _request;
    }

    public String getUrl() {
        return _request.getUrl();
    }

    public int getStatusCode() {
        return _statusCode;
    }

    public Map<String, String> getHeaders() {
        return _headers;
    }

    /**
     * @param name header name, in any case
     * @return header value, or null if the header wasn't returned
     */
    public String getHeader(String name) {
        return _headers.get(name.toLowerCase(Locale.ROOT));
    }

    public byte[] getContent() {
        return _content;
    }

    public int getContentLength() {
        return _content.length;
    }

    public String getContentType() {
        return _contentType;
    }

    public long getLatencyMs() {
        return _latencyMs;
    }

    public long getFetchTime() {
        return _fetchTime;
    }

    public ResponseStatus getStatus() {
        return _status;
    }

    public void setStatus(ResponseStatus status) {
        _status = status;
    }

    @Override
    public String toString() {
        return String.format("%d %s (%s, %d bytes, %dms)", _statusCode, getUrl(), _contentType,
                _content.length, _latencyMs);
    }

    /**
     * Handy for tests and logging; assumes UTF-8.
     */
    public String getContentAsString() {
        return new String(_content, StandardCharsets.UTF_8);
    }
}
