package com.scaleunlimited.crawlengine.throttle;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.crawlengine.config.CrawlSettings;
import com.scaleunlimited.crawlengine.pojos.ResponseStatus;

/**
 * Per-host AIMD delay controller.
 * 
 * <ul>
 * <li>Errors (5xx, timeouts, network failures, 429) add a fixed step to the delay,
 * up to the max delay.</li>
 * <li>Successful responses that are slow (over the target latency, or more than twice
 * the host's average once we have a few samples) also add a step.</li>
 * <li>Successful, fast responses shrink the delay by a constant factor, but only
 * while the host's smoothed error rate is at or under the target. The delay never
 * drops below the min delay or the host's robots.txt crawl delay.</li>
 * <li>Anything else (fast responses with a high error rate, other 4xx) leaves the
 * delay alone.</li>
 * </ul>
 */
public class AutoThrottle {
    private static final Logger LOGGER = LoggerFactory.getLogger(AutoThrottle.class);

    public static final int SC_TOO_MANY_REQUESTS = 429;

    public static final double EMA_ALPHA = 0.3;
    public static final int MIN_SAMPLES_FOR_RELATIVE_LATENCY = 3;
    public static final double SLOW_LATENCY_MULTIPLIER = 2.0;

    private final long _minDelayMs;
    private final long _maxDelayMs;
    private final long _startDelayMs;
    private final long _increaseStepMs;
    private final double _decreaseFactor;
    private final double _targetErrorRate;
    private final long _targetLatencyMs;

    private final ConcurrentMap<String, HostThrottle> _hosts;

    public AutoThrottle(CrawlSettings settings) {
        _minDelayMs = settings.getMinDelayMs();
        _maxDelayMs = settings.getMaxDelayMs();
        _startDelayMs = clamp(settings.getStartDelayMs(), _minDelayMs, _maxDelayMs);
        _increaseStepMs = settings.getIncreaseStepMs();
        _decreaseFactor = settings.getDecreaseFactor();
        _targetErrorRate = settings.getTargetErrorRate();
        _targetLatencyMs = settings.getTargetLatencyMs();

        _hosts = new ConcurrentHashMap<>();
    }

    /**
     * @param host
     * @return current delay between requests to <host>; the start delay for a
     *         host we haven't heard from yet.
     */
    public long getDelay(String host) {
        HostThrottle throttle = _hosts.get(host);
        return (throttle == null) ? _startDelayMs : throttle.getDelayMs();
    }

    public HostThrottle getHostThrottle(String host) {
        HostThrottle result = _hosts.get(host);
        if (result == null) {
            HostThrottle newThrottle = new HostThrottle(host, _startDelayMs, _minDelayMs);
            result = _hosts.putIfAbsent(host, newThrottle);
            if (result == null) {
                result = newThrottle;
            }
        }

        return result;
    }

    /**
     * Set a lower bound on the delay for <host>, e.g. from a robots.txt Crawl-delay.
     * The bound itself is capped at the max delay.
     */
    public void setFloor(String host, long floorMs) {
        HostThrottle throttle = getHostThrottle(host);
        synchronized (throttle) {
            long floor = clamp(Math.max(floorMs, _minDelayMs), _minDelayMs, _maxDelayMs);
            throttle.setFloorMs(floor);
            if (throttle.getDelayMs() < floor) {
                throttle.setDelayMs(floor);
            }

            LOGGER.debug("Set delay floor for {} to {}ms", host, floor);
        }
    }

    /**
     * Feed one completed network attempt into the controller.
     * 
     * @param host
     * @param status classification of the attempt
     * @param httpStatus HTTP status code, or 0 if there was no response
     * @param latencyMs elapsed time for the attempt
     * @return the host's new delay
     */
    public long record(String host, ResponseStatus status, int httpStatus, long latencyMs) {
        HostThrottle throttle = getHostThrottle(host);
        synchronized (throttle) {
            boolean error = status.isServerSideError() || (httpStatus == SC_TOO_MANY_REQUESTS);
            boolean slow = isSlow(throttle, latencyMs);

            throttle.addSample(latencyMs, error, EMA_ALPHA);

            long curDelay = throttle.getDelayMs();
            long newDelay = curDelay;
            if (error) {
                newDelay = Math.min(_maxDelayMs, curDelay + _increaseStepMs);
            } else if (status == ResponseStatus.OK) {
                if (slow) {
                    newDelay = Math.min(_maxDelayMs, curDelay + _increaseStepMs);
                } else if (throttle.getErrorRateEma() <= _targetErrorRate) {
                    newDelay = Math.max(throttle.getFloorMs(), (long) Math.floor(curDelay * _decreaseFactor));
                }
            }

            if (newDelay != curDelay) {
                LOGGER.trace("Delay for {} changed from {}ms to {}ms ({}, {}ms)", host, curDelay,
                        newDelay, status, latencyMs);
                throttle.setDelayMs(newDelay);
            }

            return newDelay;
        }
    }

    private boolean isSlow(HostThrottle throttle, long latencyMs) {
        if (latencyMs > _targetLatencyMs) {
            return true;
        }

        return (throttle.getNumSamples() >= MIN_SAMPLES_FOR_RELATIVE_LATENCY)
                && (latencyMs > (SLOW_LATENCY_MULTIPLIER * throttle.getLatencyEma()));
    }

    public long getMinDelayMs() {
        return _minDelayMs;
    }

    public long getMaxDelayMs() {
        return _maxDelayMs;
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }
}
