package com.scaleunlimited.crawlengine.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link CrawlSettings} from a properties file. Keys are grouped by the
 * component they tune; anything missing keeps its builder default. List
 * values are comma-separated.
 */
public class CrawlSettingsLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(CrawlSettingsLoader.class);

    public static final String STRATEGY = "scheduler.strategy";
    public static final String MAX_DEPTH = "scheduler.max_depth";
    public static final String ALLOWED_DOMAINS = "scheduler.allowed_domains";
    public static final String DEGRADED_FAILURE_THRESHOLD = "scheduler.degraded_failure_threshold";
    public static final String DEGRADED_BACKOFF_MS = "scheduler.degraded_backoff_ms";

    public static final String CONCURRENT_REQUESTS = "downloader.concurrent_requests";
    public static final String PER_HOST_CONCURRENCY = "downloader.per_host_concurrency";
    public static final String REQUEST_TIMEOUT_MS = "downloader.request_timeout_ms";
    public static final String MAX_CONTENT_SIZE = "downloader.max_content_size";
    public static final String MAX_REDIRECTS = "downloader.max_redirects";
    public static final String RETRY_CAP = "downloader.retry_cap";
    public static final String BACKOFF_BASE_MS = "downloader.backoff_base_ms";
    public static final String BACKOFF_MAX_MS = "downloader.backoff_max_ms";
    public static final String USER_AGENTS = "downloader.user_agents";
    public static final String PROXY_ENABLED = "downloader.proxy.enabled";
    public static final String HTTP_PROXIES = "downloader.proxy.http";
    public static final String HTTPS_PROXIES = "downloader.proxy.https";
    public static final String PROXY_ROTATION = "downloader.proxy.rotation";
    public static final String ROBOTS_CRAWL_DELAY = "downloader.robots_crawl_delay";

    public static final String MIN_DELAY_MS = "autothrottle.min_delay_ms";
    public static final String MAX_DELAY_MS = "autothrottle.max_delay_ms";
    public static final String START_DELAY_MS = "autothrottle.start_delay_ms";
    public static final String TARGET_ERROR_RATE = "autothrottle.target_error_rate";
    public static final String TARGET_LATENCY_MS = "autothrottle.target_latency_ms";
    public static final String INCREASE_STEP_MS = "autothrottle.increase_step_ms";
    public static final String DECREASE_FACTOR = "autothrottle.decrease_factor";

    public static final String MAX_OUTLINKS_PER_PAGE = "parser.max_outlinks_per_page";

    public static final String STATS_INTERVAL_MS = "engine.stats_interval_ms";

    private CrawlSettingsLoader() {
        // Enforce class isn't instantiated
    }

    public static CrawlSettings load(File file) throws IOException {
        LOGGER.info("Loading crawl settings from {}", file);

        try (InputStream in = new FileInputStream(file)) {
            return load(in);
        }
    }

    public static CrawlSettings load(InputStream in) throws IOException {
        Properties props = new Properties();
        props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        return fromProperties(props);
    }

    /**
     * @param props
     * @return validated settings
     * @throws IllegalArgumentException if a value can't be parsed or is out of range.
     */
    public static CrawlSettings fromProperties(Properties props) {
        return fromProperties(props, CrawlSettings.builder());
    }

    public static CrawlSettings fromProperties(Properties props, CrawlSettings.Builder builder) {
        String value;

        if ((value = get(props, STRATEGY)) != null) {
            builder.setStrategy(parseEnum(CrawlStrategy.class, STRATEGY, value));
        }
        if ((value = get(props, MAX_DEPTH)) != null) {
            builder.setMaxDepth(parseInt(MAX_DEPTH, value));
        }
        if ((value = get(props, ALLOWED_DOMAINS)) != null) {
            builder.setAllowedDomains(parseList(value));
        }
        if ((value = get(props, DEGRADED_FAILURE_THRESHOLD)) != null) {
            builder.setDegradedFailureThreshold(parseInt(DEGRADED_FAILURE_THRESHOLD, value));
        }
        if ((value = get(props, DEGRADED_BACKOFF_MS)) != null) {
            builder.setDegradedBackoffMs(parseLong(DEGRADED_BACKOFF_MS, value));
        }

        if ((value = get(props, CONCURRENT_REQUESTS)) != null) {
            builder.setConcurrentRequests(parseInt(CONCURRENT_REQUESTS, value));
        }
        if ((value = get(props, PER_HOST_CONCURRENCY)) != null) {
            builder.setPerHostConcurrency(parseInt(PER_HOST_CONCURRENCY, value));
        }
        if ((value = get(props, REQUEST_TIMEOUT_MS)) != null) {
            builder.setRequestTimeoutMs(parseInt(REQUEST_TIMEOUT_MS, value));
        }
        if ((value = get(props, MAX_CONTENT_SIZE)) != null) {
            builder.setMaxContentSize(parseInt(MAX_CONTENT_SIZE, value));
        }
        if ((value = get(props, MAX_REDIRECTS)) != null) {
            builder.setMaxRedirects(parseInt(MAX_REDIRECTS, value));
        }
        if ((value = get(props, RETRY_CAP)) != null) {
            builder.setRetryCap(parseInt(RETRY_CAP, value));
        }
        if ((value = get(props, BACKOFF_BASE_MS)) != null) {
            builder.setBackoffBaseMs(parseLong(BACKOFF_BASE_MS, value));
        }
        if ((value = get(props, BACKOFF_MAX_MS)) != null) {
            builder.setBackoffMaxMs(parseLong(BACKOFF_MAX_MS, value));
        }
        if ((value = get(props, USER_AGENTS)) != null) {
            builder.setUserAgents(parseList(value));
        }
        if ((value = get(props, PROXY_ENABLED)) != null) {
            builder.setProxyEnabled(Boolean.parseBoolean(value));
        }
        if ((value = get(props, HTTP_PROXIES)) != null) {
            builder.setHttpProxies(parseList(value));
        }
        if ((value = get(props, HTTPS_PROXIES)) != null) {
            builder.setHttpsProxies(parseList(value));
        }
        if ((value = get(props, PROXY_ROTATION)) != null) {
            builder.setProxyRotation(parseEnum(ProxyRotation.class, PROXY_ROTATION, value));
        }
        if ((value = get(props, ROBOTS_CRAWL_DELAY)) != null) {
            builder.setRobotsCrawlDelay(Boolean.parseBoolean(value));
        }

        if ((value = get(props, MIN_DELAY_MS)) != null) {
            builder.setMinDelayMs(parseLong(MIN_DELAY_MS, value));
        }
        if ((value = get(props, MAX_DELAY_MS)) != null) {
            builder.setMaxDelayMs(parseLong(MAX_DELAY_MS, value));
        }
        if ((value = get(props, START_DELAY_MS)) != null) {
            builder.setStartDelayMs(parseLong(START_DELAY_MS, value));
        }
        if ((value = get(props, TARGET_ERROR_RATE)) != null) {
            builder.setTargetErrorRate(parseDouble(TARGET_ERROR_RATE, value));
        }
        if ((value = get(props, TARGET_LATENCY_MS)) != null) {
            builder.setTargetLatencyMs(parseLong(TARGET_LATENCY_MS, value));
        }
        if ((value = get(props, INCREASE_STEP_MS)) != null) {
            builder.setIncreaseStepMs(parseLong(INCREASE_STEP_MS, value));
        }
        if ((value = get(props, DECREASE_FACTOR)) != null) {
            builder.setDecreaseFactor(parseDouble(DECREASE_FACTOR, value));
        }

        if ((value = get(props, MAX_OUTLINKS_PER_PAGE)) != null) {
            builder.setMaxOutlinksPerPage(parseInt(MAX_OUTLINKS_PER_PAGE, value));
        }

        if ((value = get(props, STATS_INTERVAL_MS)) != null) {
            builder.setStatsIntervalMs(parseLong(STATS_INTERVAL_MS, value));
        }

        return builder.build();
    }

    private static String get(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null) {
            return null;
        }

        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid integer for %s: '%s'", key, value));
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid number for %s: '%s'", key, value));
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid decimal for %s: '%s'", key, value));
        }
    }

    private static <T extends Enum<T>> T parseEnum(Class<T> clazz, String key, String value) {
        try {
            return Enum.valueOf(clazz, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format("Invalid value for %s: '%s'", key, value));
        }
    }

    private static List<String> parseList(String value) {
        List<String> result = new ArrayList<>();
        for (String item : value.split(",")) {
            item = item.trim();
            if (!item.isEmpty()) {
                result.add(item);
            }
        }

        return result;
    }
}
