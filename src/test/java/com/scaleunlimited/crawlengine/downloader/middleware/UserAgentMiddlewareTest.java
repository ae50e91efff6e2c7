package com.scaleunlimited.crawlengine.downloader.middleware;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import com.scaleunlimited.crawlengine.pojos.CrawlRequest;
import com.scaleunlimited.crawlengine.pojos.FetchContext;
import com.scaleunlimited.crawlengine.utils.HttpUtils;

public class UserAgentMiddlewareTest {

    @Test
    public void testRoundRobin() {
        UserAgentMiddleware middleware = new UserAgentMiddleware(Arrays.asList("agent-1", "agent-2"));

        assertEquals("agent-1", apply(middleware).getHeader(HttpUtils.USER_AGENT));
        assertEquals("agent-2", apply(middleware).getHeader(HttpUtils.USER_AGENT));
        assertEquals("agent-1", apply(middleware).getHeader(HttpUtils.USER_AGENT));
    }

    @Test
    public void testExplicitUserAgentWins() {
        UserAgentMiddleware middleware = new UserAgentMiddleware(Arrays.asList("agent-1"));
        FetchContext context = new FetchContext(new CrawlRequest("http://a.com/"));
        context.setHeader("user-agent", "mine");

        assertNull(middleware.processRequest(context));
        assertEquals("mine", context.getHeader(HttpUtils.USER_AGENT));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoUserAgents() {
        new UserAgentMiddleware(Collections.<String> emptyList());
    }

    private static FetchContext apply(UserAgentMiddleware middleware) {
        FetchContext context = new FetchContext(new CrawlRequest("http://a.com/"));
        assertNull(middleware.processRequest(context));
        return context;
    }
}
