package com.scaleunlimited.crawlengine.downloader.middleware;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.crawlengine.config.CrawlSettings;
import com.scaleunlimited.crawlengine.config.ProxyRotation;
import com.scaleunlimited.crawlengine.downloader.BaseDownloaderMiddleware;
import com.scaleunlimited.crawlengine.pojos.FetchContext;
import com.scaleunlimited.crawlengine.pojos.FetchOutcome;
import com.scaleunlimited.crawlengine.pojos.ResponseStatus;

/**
 * Routes each request through a proxy picked from the list for its scheme.
 * A request whose scheme has no proxies is failed without a network call.
 */
public class ProxyMiddleware extends BaseDownloaderMiddleware {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProxyMiddleware.class);

    private final Map<String, List<String>> _proxies;
    private final Map<String, AtomicInteger> _lastIndex;
    private final ProxyRotation _rotation;
    private final Random _rng;

    public ProxyMiddleware(CrawlSettings settings) {
        this(settings.getHttpProxies(), settings.getHttpsProxies(), settings.getProxyRotation(),
                new Random(System.nanoTime()));
    }

    public ProxyMiddleware(List<String> httpProxies, List<String> httpsProxies,
            ProxyRotation rotation, Random rng) {
        _proxies = new HashMap<>();
        _proxies.put("http", new ArrayList<>(httpProxies));
        _proxies.put("https", new ArrayList<>(httpsProxies));

        _lastIndex = new HashMap<>();
        _lastIndex.put("http", new AtomicInteger(0));
        _lastIndex.put("https", new AtomicInteger(0));

        _rotation = rotation;
        _rng = rng;
    }

    @Override
    public FetchOutcome processRequest(FetchContext context) {
        String scheme;
        try {
            scheme = new URL(context.getUrl()).getProtocol().toLowerCase(Locale.ROOT);
        } catch (MalformedURLException e) {
            return FetchOutcome.softFailure(ResponseStatus.CLIENT_ERROR, null,
                    "Can't pick proxy for invalid URL");
        }

        List<String> proxies = _proxies.get(scheme);
        if ((proxies == null) || proxies.isEmpty()) {
            return FetchOutcome.softFailure(ResponseStatus.CLIENT_ERROR, null,
                    "No proxy available for scheme " + scheme);
        }

        String proxy = pickProxy(scheme, proxies);
        LOGGER.trace("Using proxy {} for {}", proxy, context.getUrl());
        context.setProxy(proxy);
        return null;
    }

    private String pickProxy(String scheme, List<String> proxies) {
        switch (_rotation) {
            case RANDOM:
                synchronized (_rng) {
                    return proxies.get(_rng.nextInt(proxies.size()));
                }

            case ROUND_ROBIN:
                int index = Math.floorMod(_lastIndex.get(scheme).getAndIncrement(), proxies.size());
                return proxies.get(index);

            default:
                throw new RuntimeException("Unknown proxy rotation: " + _rotation);
        }
    }
}
