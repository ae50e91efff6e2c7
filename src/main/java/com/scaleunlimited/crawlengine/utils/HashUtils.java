package com.scaleunlimited.crawlengine.utils;

public class HashUtils {

    public static final String NO_CONTENT_HASH = "";

    private HashUtils() {
        // Enforce class isn't instantiated
    }

    /**
     * @param content request or response body, possibly null
     * @return fixed-width (16 char) hex form of the body's 64-bit hash, or
     *         {@link #NO_CONTENT_HASH} if there's no content
     */
    public static String contentHash(byte[] content) {
        if ((content == null) || (content.length == 0)) {
            return NO_CONTENT_HASH;
        }

        return String.format("%016x", joaatHash(content));
    }

    /**
     * 64-bit Jenkins one-at-a-time hash.
     */
    static long joaatHash(byte[] bytes) {
        long result = 0;
        for (byte b : bytes) {
            result += b & 0x0FFL;
            result += (result << 20);
            result ^= (result >> 12);
        }

        result += (result << 6);
        result ^= (result >> 22);
        result += (result << 30);
        return result;
    }
}
