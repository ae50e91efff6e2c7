package com.scaleunlimited.crawlengine.utils;

import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;

import org.junit.Test;

public class HashUtilsTest {

    @Test
    public void testContentHash() throws Exception {
        byte[] body = "q=shoes&page=2".getBytes(StandardCharsets.UTF_8);

        String hash = HashUtils.contentHash(body);
        assertEquals(16, hash.length());
        assertEquals(hash, HashUtils.contentHash(body.clone()));
        assertNotEquals(hash, HashUtils.contentHash("q=shoes&page=3".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testNoContent() throws Exception {
        assertEquals(HashUtils.NO_CONTENT_HASH, HashUtils.contentHash(null));
        assertEquals(HashUtils.NO_CONTENT_HASH, HashUtils.contentHash(new byte[0]));
    }

    @Test
    public void testSmallValuesAreZeroPadded() throws Exception {
        assertEquals(0L, HashUtils.joaatHash(new byte[0]));
        assertTrue(HashUtils.contentHash(new byte[] { 0 }).matches("[0-9a-f]{16}"));
    }
}
