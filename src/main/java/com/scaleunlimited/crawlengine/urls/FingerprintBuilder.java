package com.scaleunlimited.crawlengine.urls;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import com.scaleunlimited.crawlengine.pojos.CrawlRequest;
import com.scaleunlimited.crawlengine.pojos.Fingerprint;
import com.scaleunlimited.crawlengine.utils.HashUtils;

import crawlercommons.filters.basic.BasicURLNormalizer;

/**
 * Builds the canonical {@link Fingerprint} for a request: normalized URL with
 * sorted query parameters and no fragment, plus the method, plus a hash of
 * the body when there is one.
 */
public class FingerprintBuilder {

    // By name, then by value.
    private static final Comparator<String> QUERY_PARAM_COMPARATOR = new Comparator<String>() {

        @Override
        public int compare(String a, String b) {
            int nameCompare = getName(a).compareTo(getName(b));
            return (nameCompare != 0) ? nameCompare : a.compareTo(b);
        }

        private String getName(String param) {
            int equalsPos = param.indexOf('=');
            return (equalsPos == -1) ? param : param.substring(0, equalsPos);
        }
    };

    private final BasicURLNormalizer _normalizer;

    public FingerprintBuilder() {
        _normalizer = new BasicURLNormalizer();
    }

    public Fingerprint build(CrawlRequest request) {
        StringBuilder key = new StringBuilder(request.getMethod());
        key.append(' ');
        key.append(canonicalize(request.getUrl()));

        String bodyHash = HashUtils.contentHash(request.getBody());
        if (!bodyHash.equals(HashUtils.NO_CONTENT_HASH)) {
            key.append(" #");
            key.append(bodyHash);
        }

        return new Fingerprint(key.toString());
    }

    /**
     * @param url URL to canonicalize
     * @return canonical form, or the URL as-is if we can't parse it
     */
    public String canonicalize(String url) {
        String normalized = _normalizer.filter(url);
        if (normalized == null) {
            normalized = url;
        }

        URL parsed;
        try {
            parsed = new URL(normalized);
        } catch (MalformedURLException e) {
            return normalized;
        }

        StringBuilder result = new StringBuilder();
        result.append(parsed.getProtocol().toLowerCase(Locale.ROOT));
        result.append("://");
        result.append(parsed.getHost().toLowerCase(Locale.ROOT));

        int port = parsed.getPort();
        if ((port != -1) && (port != parsed.getDefaultPort())) {
            result.append(':');
            result.append(port);
        }

        String path = parsed.getPath();
        result.append(path.isEmpty() ? "/" : path);

        String query = parsed.getQuery();
        if ((query != null) && !query.isEmpty()) {
            List<String> params = new ArrayList<>();
            for (String param : query.split("&")) {
                if (!param.isEmpty()) {
                    params.add(param);
                }
            }

            Collections.sort(params, QUERY_PARAM_COMPARATOR);

            if (!params.isEmpty()) {
                result.append('?');
                result.append(String.join("&", params));
            }
        }

        return result.toString();
    }
}
