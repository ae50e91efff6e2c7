package com.scaleunlimited.crawlengine.scheduler;

import com.scaleunlimited.crawlengine.config.CrawlStrategy;
import com.scaleunlimited.crawlengine.pojos.CrawlRequest;

/**
 * Maps a request (and the state of its host) to a frontier priority. Higher
 * values are dispatched first.
 */
public class PriorityPolicy {

    // Large enough to push a degraded host's entries behind any realistic depth.
    public static final double DEGRADED_PENALTY = 1000.0;

    private final CrawlStrategy _strategy;

    public PriorityPolicy(CrawlStrategy strategy) {
        _strategy = strategy;
    }

    public CrawlStrategy getStrategy() {
        return _strategy;
    }

    public double getPriority(CrawlRequest request, HostState hostState) {
        double result;
        switch (_strategy) {
            case BFO:
            case FEEDBACK:
                result = -request.getDepth();
                break;

            case DFO:
                result = request.getDepth();
                break;

            case BASIC:
                result = 0.0;
                break;

            default:
                throw new RuntimeException("Unknown crawl strategy: " + _strategy);
        }

        if (hostState != null) {
            if (usesHostPenalty()) {
                result -= hostState.getPenalty();
            }

            if (hostState.isDegraded()) {
                result -= DEGRADED_PENALTY;
            }
        }

        return result;
    }

    public boolean usesHostPenalty() {
        return _strategy == CrawlStrategy.FEEDBACK;
    }

    public PriorityCalculator forHost(final HostState hostState) {
        return new PriorityCalculator() {

            @Override
            public double calculate(CrawlRequest request) {
                return getPriority(request, hostState);
            }
        };
    }
}
