package com.scaleunlimited.crawlengine.utils;

import org.apache.tika.mime.MediaType;

public class HttpUtils {

    public final static String CONTENT_LOCATION = "Content-Location";
    public final static String LOCATION = "Location";
    public final static String USER_AGENT = "User-Agent";
    public final static String ACCEPT = "Accept";
    public final static String ACCEPT_LANGUAGE = "Accept-Language";

    private HttpUtils() {
        // Enforce class isn't instantiated
    }

    public static String getMimeTypeFromContentType(String contentType) {
        String result = "";
        MediaType mt = MediaType.parse(contentType);
        if (mt != null) {
            result = mt.getType() + "/" + mt.getSubtype();
        }

        return result;
    }

    public static String getCharsetFromContentType(String contentType) {
        String result = "";
        MediaType mt = MediaType.parse(contentType);
        if (mt != null) {
            String charset = mt.getParameters().get("charset");
            if (charset != null) {
                result = charset;
            }
        }

        return result;
    }

    /**
     * @param contentType value of the Content-Type header (may be empty)
     * @return true if this is something we'd treat as an HTML page. An empty
     *         content type is assumed to be HTML.
     */
    public static boolean isHtml(String contentType) {
        if ((contentType == null) || contentType.trim().isEmpty()) {
            return true;
        }

        String mimeType = getMimeTypeFromContentType(contentType);
        return mimeType.equals("text/html") || mimeType.equals("application/xhtml+xml");
    }
}
