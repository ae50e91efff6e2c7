package com.scaleunlimited.crawlengine.urls;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.Locale;

public class UrlUtils {

    public static final String UNKNOWN_HOST = "";

    private UrlUtils() {
        // Enforce class isn't instantiated
    }

    /**
     * @param url
     * @return lower-cased host (with non-default port), or {@link #UNKNOWN_HOST}
     */
    public static String getHostKey(String url) {
        try {
            URL parsed = new URL(url);
            String host = parsed.getHost().toLowerCase(Locale.ROOT);
            int port = parsed.getPort();
            if ((port != -1) && (port != parsed.getDefaultPort())) {
                return host + ":" + port;
            } else {
                return host;
            }
        } catch (MalformedURLException e) {
            return UNKNOWN_HOST;
        }
    }

    /**
     * @param url
     * @return protocol + host + port, e.g. "http://domain.com:8080"
     */
    public static String getUrlWithoutPath(String url) throws MalformedURLException {
        URL parsed = new URL(url);
        String result = parsed.getProtocol() + "://" + parsed.getHost();
        if (parsed.getPort() != -1) {
            result += ":" + parsed.getPort();
        }
        return result;
    }

    /**
     * @param base
     * @param relative
     * @return absolute URL, or null if it can't be resolved
     */
    public static String resolve(URL base, String relative) {
        if (relative == null) {
            return null;
        }

        String trimmed = relative.trim();
        if (trimmed.isEmpty()) {
            return null;
        }

        try {
            return new URL(base, trimmed).toExternalForm();
        } catch (MalformedURLException e) {
            return null;
        }
    }
}
