package com.scaleunlimited.crawlengine.downloader.middleware;

import java.net.MalformedURLException;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.crawlengine.downloader.BaseDownloaderMiddleware;
import com.scaleunlimited.crawlengine.fetcher.BaseFetchException;
import com.scaleunlimited.crawlengine.fetcher.BaseHttpFetcher;
import com.scaleunlimited.crawlengine.pojos.CrawlRequest;
import com.scaleunlimited.crawlengine.pojos.FetchContext;
import com.scaleunlimited.crawlengine.pojos.FetchOutcome;
import com.scaleunlimited.crawlengine.pojos.FetchedResponse;
import com.scaleunlimited.crawlengine.throttle.AutoThrottle;
import com.scaleunlimited.crawlengine.urls.UrlUtils;
import com.scaleunlimited.crawlengine.utils.HttpUtils;

import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;

/**
 * On the first request to a host, fetches its robots.txt and uses the
 * Crawl-delay (if any) as the floor for the host's autothrottle delay.
 * Allow/disallow rules are not enforced.
 */
public class RobotsMiddleware extends BaseDownloaderMiddleware {
    private static final Logger LOGGER = LoggerFactory.getLogger(RobotsMiddleware.class);

    private final BaseHttpFetcher _fetcher;
    private final AutoThrottle _autoThrottle;
    private final String _robotName;
    private final SimpleRobotRulesParser _parser;

    private final ConcurrentMap<String, Object> _hostLocks;
    private final ConcurrentMap<String, Long> _crawlDelays;

    public RobotsMiddleware(BaseHttpFetcher fetcher, AutoThrottle autoThrottle, String userAgent) {
        _fetcher = fetcher;
        _autoThrottle = autoThrottle;
        _robotName = getRobotName(userAgent);
        _parser = new SimpleRobotRulesParser();

        _hostLocks = new ConcurrentHashMap<>();
        _crawlDelays = new ConcurrentHashMap<>();
    }

    @Override
    public FetchOutcome processRequest(FetchContext context) {
        String host = UrlUtils.getHostKey(context.getUrl());
        if (_crawlDelays.containsKey(host)) {
            return null;
        }

        Object newLock = new Object();
        Object lock = _hostLocks.putIfAbsent(host, newLock);
        if (lock == null) {
            lock = newLock;
        }

        synchronized (lock) {
            if (!_crawlDelays.containsKey(host)) {
                long crawlDelay = fetchCrawlDelay(context);
                _crawlDelays.put(host, crawlDelay);
                if (crawlDelay > 0) {
                    _autoThrottle.setFloor(host, crawlDelay);
                }
            }
        }

        return null;
    }

    /**
     * @return crawl delay in ms from the host's robots.txt, or 0 if none.
     */
    private long fetchCrawlDelay(FetchContext context) {
        String robotsUrl;
        try {
            robotsUrl = UrlUtils.getUrlWithoutPath(context.getUrl()) + "/robots.txt";
        } catch (MalformedURLException e) {
            return 0;
        }

        BaseRobotRules rules;
        try {
            FetchContext robotsContext = new FetchContext(new CrawlRequest(robotsUrl));
            robotsContext.setHeader(HttpUtils.USER_AGENT, context.getHeader(HttpUtils.USER_AGENT) == null
                    ? _robotName : context.getHeader(HttpUtils.USER_AGENT));
            robotsContext.setProxy(context.getProxy());

            FetchedResponse response = _fetcher.get(robotsContext);
            int statusCode = response.getStatusCode();
            LOGGER.trace("Fetched '{}' with status {}", robotsUrl, statusCode);

            if (statusCode == HttpStatus.SC_OK) {
                rules = _parser.parseContent(robotsUrl, response.getContent(),
                        response.getContentType(), _robotName);
            } else {
                rules = _parser.failedFetch(statusCode);
            }
        } catch (BaseFetchException e) {
            LOGGER.debug("Failed to fetch '{}': {}", robotsUrl, e.getMessage());
            rules = _parser.failedFetch(HttpStatus.SC_INTERNAL_SERVER_ERROR);
        }

        long crawlDelay = rules.getCrawlDelay();
        if (crawlDelay == BaseRobotRules.UNSET_CRAWL_DELAY || crawlDelay <= 0) {
            return 0;
        }

        LOGGER.info("Using robots.txt crawl delay of {}ms for {}", crawlDelay, robotsUrl);
        return crawlDelay;
    }

    public Long getCrawlDelay(String host) {
        return _crawlDelays.get(host);
    }

    /**
     * @param userAgent full User-Agent header value
     * @return the product token (before the first '/' or space), lower-cased
     */
    private static String getRobotName(String userAgent) {
        String result = userAgent.trim();
        int endPos = result.length();
        int slashPos = result.indexOf('/');
        int spacePos = result.indexOf(' ');
        if (slashPos != -1) {
            endPos = Math.min(endPos, slashPos);
        }
        if (spacePos != -1) {
            endPos = Math.min(endPos, spacePos);
        }

        return result.substring(0, endPos).toLowerCase(Locale.ROOT);
    }
}
