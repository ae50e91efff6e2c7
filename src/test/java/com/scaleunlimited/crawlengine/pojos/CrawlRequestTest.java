package com.scaleunlimited.crawlengine.pojos;

import static org.junit.Assert.*;

import java.util.Collections;
import java.util.Locale;

import org.junit.Test;

public class CrawlRequestTest {

    @Test
    public void testDerivedRequests() throws Exception {
        CrawlRequest request = new CrawlRequest("http://example.com/form", "post",
                Collections.singletonMap("X-Token", "abc"), new byte[] { 1, 2 }, 2,
                Collections.singletonMap("category", "shoes"), 0, 0);
        assertEquals("POST", request.getMethod());
        assertTrue(request.hasBody());

        CrawlRequest child = request.makeChild("http://example.com/next");
        assertEquals(3, child.getDepth());
        assertEquals(CrawlRequest.DEFAULT_METHOD, child.getMethod());
        assertFalse(child.hasBody());
        assertTrue(child.getHeaders().isEmpty());
        assertEquals("shoes", child.getMetadata().get("category"));

        CrawlRequest redirect = request.makeRedirect("http://example.com/moved");
        assertEquals(2, redirect.getDepth());
        assertEquals(1, redirect.getRedirectCount());
        assertEquals("POST", redirect.getMethod());
        assertEquals("abc", redirect.getHeaders().get("X-Token"));

        request.setPriority(0.75);
        CrawlRequest retry = request.makeRetry();
        assertEquals(request.getUrl(), retry.getUrl());
        assertEquals(1, retry.getRetryCount());
        assertEquals(0.75, retry.getPriority(), 0.0001);
    }

    @Test
    public void testMethodIgnoresDefaultLocale() throws Exception {
        Locale defaultLocale = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));

        try {
            CrawlRequest request = new CrawlRequest("http://example.com/", "options",
                    Collections.<String, String> emptyMap(), null, 0,
                    Collections.<String, String> emptyMap(), 0, 0);
            assertEquals("OPTIONS", request.getMethod());
        } finally {
            Locale.setDefault(defaultLocale);
        }
    }

    @Test
    public void testBodyIsCopied() throws Exception {
        byte[] body = new byte[] { 1, 2, 3 };
        CrawlRequest request = new CrawlRequest("http://example.com/", "POST",
                Collections.<String, String> emptyMap(), body, 0, Collections.<String, String> emptyMap(), 0, 0);
        body[0] = 9;
        assertEquals(1, request.getBody()[0]);
    }

    @Test
    public void testInvalidRequests() throws Exception {
        try {
            new CrawlRequest(null);
            fail("Should have thrown exception");
        } catch (IllegalArgumentException e) {
            // expected
        }

        try {
            new CrawlRequest("http://example.com/", -1);
            fail("Should have thrown exception");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
