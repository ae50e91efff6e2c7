package com.scaleunlimited.crawlengine.downloader.middleware;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import com.scaleunlimited.crawlengine.downloader.BaseDownloaderMiddleware;
import com.scaleunlimited.crawlengine.pojos.FetchContext;
import com.scaleunlimited.crawlengine.pojos.FetchOutcome;
import com.scaleunlimited.crawlengine.utils.HttpUtils;

/**
 * Sets the User-Agent header, cycling through the configured agents in order.
 */
public class UserAgentMiddleware extends BaseDownloaderMiddleware {

    private final List<String> _userAgents;
    private final AtomicInteger _nextIndex;

    public UserAgentMiddleware(List<String> userAgents) {
        if (userAgents.isEmpty()) {
            throw new IllegalArgumentException("At least one user agent is required");
        }

        _userAgents = new ArrayList<>(userAgents);
        _nextIndex = new AtomicInteger(0);
    }

    @Override
    public FetchOutcome processRequest(FetchContext context) {
        if (context.getHeader(HttpUtils.USER_AGENT) == null) {
            context.setHeader(HttpUtils.USER_AGENT, nextUserAgent());
        }

        return null;
    }

    private String nextUserAgent() {
        int index = Math.floorMod(_nextIndex.getAndIncrement(), _userAgents.size());
        return _userAgents.get(index);
    }
}
