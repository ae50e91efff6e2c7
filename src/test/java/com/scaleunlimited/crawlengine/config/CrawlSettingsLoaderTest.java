package com.scaleunlimited.crawlengine.config;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Properties;

import org.junit.Test;

public class CrawlSettingsLoaderTest {

    @Test
    public void testDefaults() throws Exception {
        CrawlSettings settings = CrawlSettingsLoader.fromProperties(new Properties());

        assertEquals(CrawlStrategy.BFO, settings.getStrategy());
        assertEquals(16, settings.getConcurrentRequests());
        assertEquals(2, settings.getPerHostConcurrency());
        assertEquals(CrawlSettings.UNLIMITED_DEPTH, settings.getMaxDepth());
        assertEquals(3, settings.getRetryCap());
        assertTrue(settings.getAllowedDomains().isEmpty());
        assertEquals(CrawlSettings.DEFAULT_USER_AGENT, settings.getUserAgents().get(0));
        assertFalse(settings.isProxyEnabled());
    }

    @Test
    public void testLoadFromStream() throws Exception {
        String text = "# Crawl settings\n"
                + "scheduler.strategy = dfo\n"
                + "scheduler.max_depth = 3\n"
                + "scheduler.allowed_domains = example.com, example.org,\n"
                + "downloader.concurrent_requests = 32\n"
                + "downloader.user_agents = bot-a/1.0,bot-b/2.0\n"
                + "downloader.proxy.enabled = true\n"
                + "downloader.proxy.http = proxy1:8080\n"
                + "downloader.proxy.rotation = random\n"
                + "autothrottle.decrease_factor = 0.5\n"
                + "autothrottle.start_delay_ms = 250\n"
                + "parser.max_outlinks_per_page = 20\n"
                + "engine.stats_interval_ms = \n";

        CrawlSettings settings = CrawlSettingsLoader.load(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));

        assertEquals(CrawlStrategy.DFO, settings.getStrategy());
        assertEquals(3, settings.getMaxDepth());
        assertEquals(Arrays.asList("example.com", "example.org"), settings.getAllowedDomains());
        assertEquals(32, settings.getConcurrentRequests());
        assertEquals(Arrays.asList("bot-a/1.0", "bot-b/2.0"), settings.getUserAgents());
        assertTrue(settings.isProxyEnabled());
        assertEquals(Arrays.asList("proxy1:8080"), settings.getHttpProxies());
        assertEquals(ProxyRotation.RANDOM, settings.getProxyRotation());
        assertEquals(0.5, settings.getDecreaseFactor(), 0.0001);
        assertEquals(250, settings.getStartDelayMs());
        assertEquals(20, settings.getMaxOutlinksPerPage());

        // Empty values keep the default.
        assertEquals(CrawlSettings.builder().build().getStatsIntervalMs(), settings.getStatsIntervalMs());
    }

    @Test
    public void testOverridesBuilder() throws Exception {
        Properties props = new Properties();
        props.setProperty(CrawlSettingsLoader.RETRY_CAP, "1");

        CrawlSettings base = CrawlSettings.builder().setMaxDepth(4).setRetryCap(7).build();
        CrawlSettings settings = CrawlSettingsLoader.fromProperties(props, base.toBuilder());
        assertEquals(4, settings.getMaxDepth());
        assertEquals(1, settings.getRetryCap());
    }

    @Test
    public void testInvalidValues() throws Exception {
        assertInvalid(CrawlSettingsLoader.CONCURRENT_REQUESTS, "lots", "Invalid integer");
        assertInvalid(CrawlSettingsLoader.BACKOFF_BASE_MS, "1.5", "Invalid number");
        assertInvalid(CrawlSettingsLoader.TARGET_ERROR_RATE, "high", "Invalid decimal");
        assertInvalid(CrawlSettingsLoader.STRATEGY, "random", "Invalid value");
        assertInvalid(CrawlSettingsLoader.CONCURRENT_REQUESTS, "0", "Invalid crawl settings");
        assertInvalid(CrawlSettingsLoader.TARGET_ERROR_RATE, "1.5", "Invalid crawl settings");
        assertInvalid(CrawlSettingsLoader.PROXY_ENABLED, "true", "no proxies are configured");
    }

    private static void assertInvalid(String key, String value, String expectedMsg) {
        Properties props = new Properties();
        props.setProperty(key, value);

        try {
            CrawlSettingsLoader.fromProperties(props);
            fail("Should have thrown exception for " + key + "=" + value);
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(expectedMsg));
        }
    }
}
