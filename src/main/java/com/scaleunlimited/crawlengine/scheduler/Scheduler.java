package com.scaleunlimited.crawlengine.scheduler;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.crawlengine.config.CrawlSettings;
import com.scaleunlimited.crawlengine.crawldb.BaseFingerprintStore;
import com.scaleunlimited.crawlengine.metrics.CrawlerAccumulator;
import com.scaleunlimited.crawlengine.metrics.CrawlerMetrics;
import com.scaleunlimited.crawlengine.pojos.CrawlRequest;
import com.scaleunlimited.crawlengine.pojos.FetchOutcome;
import com.scaleunlimited.crawlengine.pojos.Fingerprint;
import com.scaleunlimited.crawlengine.throttle.AutoThrottle;
import com.scaleunlimited.crawlengine.urls.BaseUrlValidator;
import com.scaleunlimited.crawlengine.urls.FingerprintBuilder;
import com.scaleunlimited.crawlengine.urls.UrlUtils;
import com.scaleunlimited.crawlengine.utils.UrlLogger;

/**
 * Single owner of the frontier, the fingerprint store and per-host state.
 * Every mutation happens under one lock, so admission is an atomic
 * test-and-insert and dispatch decisions see a consistent view.
 * 
 * Every request returned by {@link #next()} must be matched by exactly one
 * call to {@link #reportOutcome(CrawlRequest, FetchOutcome)}.
 */
public class Scheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(Scheduler.class);

    public static final long NO_ELIGIBLE_TIME = Long.MAX_VALUE;

    private final CrawlSettings _settings;
    private final BaseFingerprintStore _fingerprintStore;
    private final FingerprintBuilder _fingerprintBuilder;
    private final BaseUrlValidator _urlValidator;
    private final AutoThrottle _autoThrottle;
    private final PriorityPolicy _priorityPolicy;
    private final CrawlerAccumulator _accumulator;

    private final ReentrantLock _lock;
    private final Condition _changed;

    private final Frontier _frontier;
    private final Map<String, HostState> _hosts;
    private final Map<CrawlRequest, String> _inFlight;

    private long _nextSequence;

    public Scheduler(CrawlSettings settings, BaseFingerprintStore fingerprintStore,
            BaseUrlValidator urlValidator, AutoThrottle autoThrottle, CrawlerAccumulator accumulator) {
        _settings = settings;
        _fingerprintStore = fingerprintStore;
        _fingerprintBuilder = new FingerprintBuilder();
        _urlValidator = urlValidator;
        _autoThrottle = autoThrottle;
        _priorityPolicy = new PriorityPolicy(settings.getStrategy());
        _accumulator = accumulator;

        _lock = new ReentrantLock();
        _changed = _lock.newCondition();

        _frontier = new Frontier();
        _hosts = new HashMap<>();
        _inFlight = new IdentityHashMap<>();
        _nextSequence = 0;
    }

    /**
     * Offer a request for crawling. On acceptance the fingerprint is marked as
     * seen before we return, so a concurrent admit of an equivalent request
     * is rejected as a duplicate.
     */
    public AdmissionResult admit(CrawlRequest request) {
        AdmissionResult result = doAdmit(request);
        switch (result) {
            case ADMITTED:
                _accumulator.increment(CrawlerMetrics.COUNTER_REQUESTS_ADMITTED);
                UrlLogger.record(Scheduler.class, request, "depth", Integer.toString(request.getDepth()));
                break;

            case REJECTED_DUPLICATE:
                _accumulator.increment(CrawlerMetrics.COUNTER_REJECTED_DUPLICATE);
                break;

            case REJECTED_DEPTH:
                _accumulator.increment(CrawlerMetrics.COUNTER_REJECTED_DEPTH);
                break;

            case REJECTED_FILTERED:
                _accumulator.increment(CrawlerMetrics.COUNTER_REJECTED_FILTERED);
                break;

            default:
                throw new RuntimeException("Unknown admission result: " + result);
        }

        if (!result.isAdmitted()) {
            LOGGER.trace("Rejected {} ({})", request.getUrl(), result);
        }

        return result;
    }

    /**
     * @return number of <requests> that were admitted
     */
    public int admitAll(Collection<CrawlRequest> requests) {
        int result = 0;
        for (CrawlRequest request : requests) {
            if (admit(request).isAdmitted()) {
                result++;
            }
        }

        return result;
    }

    private AdmissionResult doAdmit(CrawlRequest request) {
        if (!_urlValidator.isValid(request.getUrl())) {
            return AdmissionResult.REJECTED_FILTERED;
        }

        int maxDepth = _settings.getMaxDepth();
        if ((maxDepth != CrawlSettings.UNLIMITED_DEPTH) && (request.getDepth() > maxDepth)) {
            return AdmissionResult.REJECTED_DEPTH;
        }

        Fingerprint fingerprint = _fingerprintBuilder.build(request);

        _lock.lock();
        try {
            if (!_fingerprintStore.markSeen(fingerprint)) {
                return AdmissionResult.REJECTED_DUPLICATE;
            }

            enqueue(request, 0);
            return AdmissionResult.ADMITTED;
        } finally {
            _lock.unlock();
        }
    }

    /**
     * Pop the best request that can go out right now, or return null if nothing
     * is currently eligible (which doesn't mean the frontier is empty).
     */
    public CrawlRequest next() {
        return next(System.currentTimeMillis());
    }

    public CrawlRequest next(long now) {
        _lock.lock();
        try {
            // Each ready host contributes only its best ready entry.
            FrontierEntry entry = null;
            for (String host : _frontier.getHosts()) {
                if (getEligibleTime(getHostState(host)) > now) {
                    continue;
                }

                FrontierEntry candidate = _frontier.firstReady(host, now);
                if ((candidate != null) && ((entry == null) || (Frontier.ENTRY_ORDER.compare(candidate, entry) < 0))) {
                    entry = candidate;
                }
            }

            if (entry != null) {
                String host = entry.getHost();
                HostState hostState = getHostState(host);
                _frontier.remove(entry);
                hostState.dispatched(now);

                CrawlRequest result = entry.getRequest();
                _inFlight.put(result, host);
                _accumulator.increment(CrawlerMetrics.COUNTER_REQUESTS_DISPATCHED);
                return result;
            }

            return null;
        } finally {
            _lock.unlock();
        }
    }

    /**
     * Report what happened to a dispatched request. Releases its in-flight slot,
     * updates host feedback, and re-queues the request if the outcome is a retry.
     * 
     * @throws IllegalStateException if <request> isn't currently in flight.
     */
    public void reportOutcome(CrawlRequest request, FetchOutcome outcome) {
        reportOutcome(request, outcome, System.currentTimeMillis());
    }

    public void reportOutcome(CrawlRequest request, FetchOutcome outcome, long now) {
        _lock.lock();
        try {
            String host = _inFlight.remove(request);
            if (host == null) {
                throw new IllegalStateException("Outcome reported for a request that isn't in flight: " + request);
            }

            HostState hostState = getHostState(host);
            hostState.completed(now, outcome.getLatencyMs());

            boolean unhealthy = !outcome.isHealthy();
            boolean reprioritize = false;
            if (unhealthy) {
                if (hostState.failed(now, _settings.getDegradedFailureThreshold(), _settings.getDegradedBackoffMs())) {
                    LOGGER.warn("Host {} is degraded after {} consecutive failures, backing off for {}ms",
                            host, hostState.getConsecutiveFailures(), _settings.getDegradedBackoffMs());
                    _accumulator.increment(CrawlerMetrics.COUNTER_HOSTS_DEGRADED);
                    reprioritize = true;
                }
            } else if (hostState.succeeded()) {
                LOGGER.info("Host {} has recovered", host);
                reprioritize = true;
            }

            if (_priorityPolicy.usesHostPenalty()) {
                boolean slow = outcome.getLatencyMs() > _settings.getTargetLatencyMs();
                reprioritize |= hostState.adjustPenalty(unhealthy || slow);
            }

            if (reprioritize) {
                int numChanged = _frontier.reprioritize(host, _priorityPolicy.forHost(hostState));
                LOGGER.debug("Re-prioritized {} queued requests for {}", numChanged, host);
            }

            if (outcome.getKind() == FetchOutcome.Kind.RETRY) {
                // Retries skip the fingerprint check, since the target was already admitted once.
                CrawlRequest retry = request.makeRetry();
                enqueue(retry, now + outcome.getRetryDelayMs());
                _accumulator.increment(CrawlerMetrics.COUNTER_RETRIES_SCHEDULED);
                UrlLogger.record(Scheduler.class, retry, "retry", Integer.toString(retry.getRetryCount()));
            }

            _changed.signalAll();
        } finally {
            _lock.unlock();
        }
    }

    /**
     * @return true if nothing is queued and nothing is in flight.
     */
    public boolean isQuiescent() {
        _lock.lock();
        try {
            return _frontier.isEmpty() && _inFlight.isEmpty();
        } finally {
            _lock.unlock();
        }
    }

    /**
     * @param now
     * @return ms until some queued request could become eligible, 0 if one is
     *         eligible now, or {@link #NO_ELIGIBLE_TIME} if we have to wait for
     *         an in-flight request to complete (or the frontier is empty).
     */
    public long getNextEligibleDelay(long now) {
        _lock.lock();
        try {
            long result = NO_ELIGIBLE_TIME;
            for (String host : _frontier.getHosts()) {
                long hostTime = getEligibleTime(getHostState(host));
                if (hostTime == NO_ELIGIBLE_TIME) {
                    continue;
                }

                long eligibleTime = _frontier.getEarliestNotBefore(host, hostTime);
                result = Math.min(result, Math.max(0, eligibleTime - now));
                if (result == 0) {
                    break;
                }
            }

            return result;
        } finally {
            _lock.unlock();
        }
    }

    /**
     * Block until the scheduler state changes (a request is admitted, or an
     * outcome is reported), or until something should become eligible, but
     * never longer than maxWaitMs.
     */
    public void awaitChange(long maxWaitMs) throws InterruptedException {
        _lock.lock();
        try {
            long waitMs = Math.min(maxWaitMs, getNextEligibleDelay(System.currentTimeMillis()));
            if (waitMs > 0) {
                _changed.await(waitMs, TimeUnit.MILLISECONDS);
            }
        } finally {
            _lock.unlock();
        }
    }

    /**
     * Block until an admission or an outcome report, ignoring when queued
     * requests become eligible. Used when we can't dispatch anyway.
     */
    public void awaitSignal(long maxWaitMs) throws InterruptedException {
        _lock.lock();
        try {
            _changed.await(maxWaitMs, TimeUnit.MILLISECONDS);
        } finally {
            _lock.unlock();
        }
    }

    /**
     * Wake up anyone blocked in {@link #awaitChange(long)}.
     */
    public void wakeUp() {
        _lock.lock();
        try {
            _changed.signalAll();
        } finally {
            _lock.unlock();
        }
    }

    public int getQueueSize() {
        _lock.lock();
        try {
            return _frontier.size();
        } finally {
            _lock.unlock();
        }
    }

    public int getInFlightCount() {
        _lock.lock();
        try {
            return _inFlight.size();
        } finally {
            _lock.unlock();
        }
    }

    public int getInFlightCount(String host) {
        _lock.lock();
        try {
            HostState hostState = _hosts.get(host);
            return (hostState == null) ? 0 : hostState.getInFlight();
        } finally {
            _lock.unlock();
        }
    }

    /**
     * @return copy of the in-flight requests, e.g. for reporting cancelled fetches.
     */
    public Set<CrawlRequest> getInFlightRequests() {
        _lock.lock();
        try {
            Set<CrawlRequest> result = Collections.newSetFromMap(new IdentityHashMap<CrawlRequest, Boolean>());
            result.addAll(_inFlight.keySet());
            return result;
        } finally {
            _lock.unlock();
        }
    }

    public boolean isHostDegraded(String host) {
        _lock.lock();
        try {
            HostState hostState = _hosts.get(host);
            return (hostState != null) && hostState.isDegraded();
        } finally {
            _lock.unlock();
        }
    }

    public CrawlSettings getSettings() {
        return _settings;
    }

    /**
     * Drop everything still waiting in the frontier.
     * 
     * @return number of requests dropped
     */
    public int clearFrontier() {
        _lock.lock();
        try {
            int result = _frontier.size();
            _frontier.clear();
            _changed.signalAll();
            return result;
        } finally {
            _lock.unlock();
        }
    }

    private void enqueue(CrawlRequest request, long notBefore) {
        String host = UrlUtils.getHostKey(request.getUrl());
        HostState hostState = getHostState(host);
        double priority = _priorityPolicy.getPriority(request, hostState);
        _frontier.add(new FrontierEntry(request, host, priority, _nextSequence++, notBefore));
        _changed.signalAll();
    }

    /**
     * @return time at which <hostState>'s host can take another request, or
     *         {@link #NO_ELIGIBLE_TIME} if that depends on an in-flight request finishing.
     */
    private long getEligibleTime(HostState hostState) {
        long delay = _autoThrottle.getDelay(hostState.getHost());
        long result = hostState.getBackoffUntil();

        if (delay > 0) {
            // Throttled hosts get serialized access.
            if (hostState.getInFlight() > 0) {
                return NO_ELIGIBLE_TIME;
            }

            result = Math.max(result, hostState.getLastActivityTime() + delay);
        } else if (hostState.getInFlight() >= _settings.getPerHostConcurrency()) {
            return NO_ELIGIBLE_TIME;
        }

        return result;
    }

    private HostState getHostState(String host) {
        HostState result = _hosts.get(host);
        if (result == null) {
            result = new HostState(host);
            _hosts.put(host, result);
        }

        return result;
    }
}
