package com.scaleunlimited.crawlengine.urls;

import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.util.Collections;

import org.junit.Test;

import com.scaleunlimited.crawlengine.pojos.CrawlRequest;

public class FingerprintBuilderTest {

    @Test
    public void testCanonicalize() {
        FingerprintBuilder builder = new FingerprintBuilder();

        assertEquals("http://foo.com/", builder.canonicalize("http://foo.com"));
        assertEquals("http://foo.com/", builder.canonicalize("HTTP://FOO.COM/"));
        assertEquals("http://foo.com/page", builder.canonicalize("http://foo.com:80/page"));
        assertEquals("http://foo.com:8080/page", builder.canonicalize("http://foo.com:8080/page"));
        assertEquals("http://foo.com/page", builder.canonicalize("http://foo.com/page#section"));
    }

    @Test
    public void testQueryParamOrderDoesNotMatter() {
        FingerprintBuilder builder = new FingerprintBuilder();

        assertEquals(builder.build(new CrawlRequest("http://foo.com/search?b=2&a=1")),
                builder.build(new CrawlRequest("http://foo.com/search?a=1&b=2")));
        assertEquals("http://foo.com/search?a=1&a=2&b=0", builder.canonicalize("http://foo.com/search?b=0&a=2&a=1"));
    }

    @Test
    public void testMethodAndBodyAreSignificant() {
        FingerprintBuilder builder = new FingerprintBuilder();
        String url = "http://foo.com/form";
        CrawlRequest get = new CrawlRequest(url);
        CrawlRequest post1 = new CrawlRequest(url, "POST", Collections.<String, String> emptyMap(),
                "q=1".getBytes(StandardCharsets.UTF_8), 0,
                Collections.<String, String> emptyMap(), 0, 0);
        CrawlRequest post1Again = new CrawlRequest(url, "POST", Collections.<String, String> emptyMap(),
                "q=1".getBytes(StandardCharsets.UTF_8), 0,
                Collections.<String, String> emptyMap(), 0, 0);
        CrawlRequest post2 = new CrawlRequest(url, "POST", Collections.<String, String> emptyMap(),
                "q=2".getBytes(StandardCharsets.UTF_8), 0,
                Collections.<String, String> emptyMap(), 0, 0);

        assertNotEquals(builder.build(get), builder.build(post1));
        assertEquals(builder.build(post1), builder.build(post1Again));
        assertNotEquals(builder.build(post1), builder.build(post2));
    }

    @Test
    public void testDepthIsNotSignificant() {
        FingerprintBuilder builder = new FingerprintBuilder();
        assertEquals(builder.build(new CrawlRequest("http://foo.com/a", 0)),
                builder.build(new CrawlRequest("http://foo.com/a", 3)));
    }
}
