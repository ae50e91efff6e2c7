package com.scaleunlimited.crawlengine.downloader.middleware;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.Test;

import com.scaleunlimited.crawlengine.config.ProxyRotation;
import com.scaleunlimited.crawlengine.pojos.CrawlRequest;
import com.scaleunlimited.crawlengine.pojos.FetchContext;
import com.scaleunlimited.crawlengine.pojos.FetchOutcome;
import com.scaleunlimited.crawlengine.pojos.ResponseStatus;

public class ProxyMiddlewareTest {

    private static final List<String> HTTP_PROXIES = Arrays.asList("http://p1:8080", "http://p2:8080",
            "http://p3:8080");

    @Test
    public void testRoundRobin() {
        ProxyMiddleware middleware = new ProxyMiddleware(HTTP_PROXIES, Collections.<String> emptyList(),
                ProxyRotation.ROUND_ROBIN, new Random(1L));

        for (int i = 0; i < 6; i++) {
            FetchContext context = new FetchContext(new CrawlRequest("http://a.com/" + i));
            assertNull(middleware.processRequest(context));
            assertEquals(HTTP_PROXIES.get(i % 3), context.getProxy());
        }
    }

    @Test
    public void testRandomStaysWithinList() {
        ProxyMiddleware middleware = new ProxyMiddleware(HTTP_PROXIES, Collections.<String> emptyList(),
                ProxyRotation.RANDOM, new Random(1L));

        Set<String> used = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            FetchContext context = new FetchContext(new CrawlRequest("http://a.com/" + i));
            assertNull(middleware.processRequest(context));
            used.add(context.getProxy());
        }

        assertTrue(HTTP_PROXIES.containsAll(used));
        assertTrue(used.size() > 1);
    }

    @Test
    public void testNoProxyForScheme() {
        ProxyMiddleware middleware = new ProxyMiddleware(HTTP_PROXIES, Collections.<String> emptyList(),
                ProxyRotation.ROUND_ROBIN, new Random(1L));

        FetchContext context = new FetchContext(new CrawlRequest("https://a.com/"));
        FetchOutcome outcome = middleware.processRequest(context);
        assertNotNull(outcome);
        assertEquals(FetchOutcome.Kind.SOFT_FAILURE, outcome.getKind());
        assertEquals(ResponseStatus.CLIENT_ERROR, outcome.getStatus());
        assertNull(context.getProxy());
    }
}
