package com.scaleunlimited.crawlengine.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of everything that tunes a crawl. Create one with
 * {@link #builder()}, or load it from a properties file via
 * {@link CrawlSettingsLoader}.
 */
public class CrawlSettings {

    public static final String DEFAULT_USER_AGENT = "crawl-engine/0.1 (+http://www.scaleunlimited.com)";

    public static final int UNLIMITED_DEPTH = -1;

    private final CrawlStrategy _strategy;
    private final int _concurrentRequests;
    private final int _perHostConcurrency;

    private final long _minDelayMs;
    private final long _maxDelayMs;
    private final long _startDelayMs;
    private final double _targetErrorRate;
    private final long _targetLatencyMs;
    private final long _increaseStepMs;
    private final double _decreaseFactor;

    private final int _retryCap;
    private final long _backoffBaseMs;
    private final long _backoffMaxMs;

    private final int _maxDepth;
    private final List<String> _allowedDomains;

    private final boolean _proxyEnabled;
    private final List<String> _httpProxies;
    private final List<String> _httpsProxies;
    private final ProxyRotation _proxyRotation;

    private final List<String> _userAgents;
    private final boolean _robotsCrawlDelay;

    private final int _requestTimeoutMs;
    private final int _maxContentSize;
    private final int _maxRedirects;
    private final int _maxOutlinksPerPage;

    private final int _degradedFailureThreshold;
    private final long _degradedBackoffMs;

    private final long _statsIntervalMs;

    private CrawlSettings(Builder builder) {
        _strategy = builder._strategy;
        _concurrentRequests = builder._concurrentRequests;
        _perHostConcurrency = builder._perHostConcurrency;
        _minDelayMs = builder._minDelayMs;
        _maxDelayMs = builder._maxDelayMs;
        _startDelayMs = builder._startDelayMs;
        _targetErrorRate = builder._targetErrorRate;
        _targetLatencyMs = builder._targetLatencyMs;
        _increaseStepMs = builder._increaseStepMs;
        _decreaseFactor = builder._decreaseFactor;
        _retryCap = builder._retryCap;
        _backoffBaseMs = builder._backoffBaseMs;
        _backoffMaxMs = builder._backoffMaxMs;
        _maxDepth = builder._maxDepth;
        _allowedDomains = Collections.unmodifiableList(new ArrayList<>(builder._allowedDomains));
        _proxyEnabled = builder._proxyEnabled;
        _httpProxies = Collections.unmodifiableList(new ArrayList<>(builder._httpProxies));
        _httpsProxies = Collections.unmodifiableList(new ArrayList<>(builder._httpsProxies));
        _proxyRotation = builder._proxyRotation;
        _userAgents = Collections.unmodifiableList(new ArrayList<>(builder._userAgents));
        _robotsCrawlDelay = builder._robotsCrawlDelay;
        _requestTimeoutMs = builder._requestTimeoutMs;
        _maxContentSize = builder._maxContentSize;
        _maxRedirects = builder._maxRedirects;
        _maxOutlinksPerPage = builder._maxOutlinksPerPage;
        _degradedFailureThreshold = builder._degradedFailureThreshold;
        _degradedBackoffMs = builder._degradedBackoffMs;
        _statsIntervalMs = builder._statsIntervalMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-loaded with these settings, for making a modified copy.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public CrawlStrategy getStrategy() {
        return _strategy;
    }

    public int getConcurrentRequests() {
        return _concurrentRequests;
    }

    public int getPerHostConcurrency() {
        return _perHostConcurrency;
    }

    public long getMinDelayMs() {
        return _minDelayMs;
    }

    public long getMaxDelayMs() {
        return _maxDelayMs;
    }

    public long getStartDelayMs() {
        return _startDelayMs;
    }

    public double getTargetErrorRate() {
        return _targetErrorRate;
    }

    public long getTargetLatencyMs() {
        return _targetLatencyMs;
    }

    public long getIncreaseStepMs() {
        return _increaseStepMs;
    }

    public double getDecreaseFactor() {
        return _decreaseFactor;
    }

    public int getRetryCap() {
        return _retryCap;
    }

    public long getBackoffBaseMs() {
        return _backoffBaseMs;
    }

    public long getBackoffMaxMs() {
        return _backoffMaxMs;
    }

    public int getMaxDepth() {
        return _maxDepth;
    }

    public List<String> getAllowedDomains() {
        return _allowedDomains;
    }

    public boolean isProxyEnabled() {
        return _proxyEnabled;
    }

    public List<String> getHttpProxies() {
        return _httpProxies;
    }

    public List<String> getHttpsProxies() {
        return _httpsProxies;
    }

    public ProxyRotation getProxyRotation() {
        return _proxyRotation;
    }

    public List<String> getUserAgents() {
        return _userAgents;
    }

    public boolean isRobotsCrawlDelay() {
        return _robotsCrawlDelay;
    }

    public int getRequestTimeoutMs() {
        return _requestTimeoutMs;
    }

    public int getMaxContentSize() {
        return _maxContentSize;
    }

    public int getMaxRedirects() {
        return _maxRedirects;
    }

    public int getMaxOutlinksPerPage() {
        return _maxOutlinksPerPage;
    }

    public int getDegradedFailureThreshold() {
        return _degradedFailureThreshold;
    }

    public long getDegradedBackoffMs() {
        return _degradedBackoffMs;
    }

    public long getStatsIntervalMs() {
        return _statsIntervalMs;
    }

    @Override
    public String toString() {
        return String.format(
                "strategy=%s, concurrency=%d/%d per host, delay=%d..%dms (start %d), targetErrorRate=%.2f, retryCap=%d, maxDepth=%d, proxy=%s",
                _strategy, _concurrentRequests, _perHostConcurrency, _minDelayMs, _maxDelayMs,
                _startDelayMs, _targetErrorRate, _retryCap, _maxDepth, _proxyEnabled);
    }

    public static class Builder {

        private CrawlStrategy _strategy = CrawlStrategy.BFO;
        private int _concurrentRequests = 16;
        private int _perHostConcurrency = 2;

        private long _minDelayMs = 0;
        private long _maxDelayMs = 60 * 1000L;
        private long _startDelayMs = 500;
        private double _targetErrorRate = 0.1;
        private long _targetLatencyMs = 5 * 1000L;
        private long _increaseStepMs = 500;
        private double _decreaseFactor = 0.75;

        private int _retryCap = 3;
        private long _backoffBaseMs = 1000;
        private long _backoffMaxMs = 60 * 1000L;

        private int _maxDepth = UNLIMITED_DEPTH;
        private List<String> _allowedDomains = new ArrayList<>();

        private boolean _proxyEnabled = false;
        private List<String> _httpProxies = new ArrayList<>();
        private List<String> _httpsProxies = new ArrayList<>();
        private ProxyRotation _proxyRotation = ProxyRotation.RANDOM;

        private List<String> _userAgents = new ArrayList<>(Collections.singletonList(DEFAULT_USER_AGENT));
        private boolean _robotsCrawlDelay = false;

        private int _requestTimeoutMs = 30 * 1000;
        private int _maxContentSize = 1024 * 1024;
        private int _maxRedirects = 5;
        private int _maxOutlinksPerPage = 100;

        private int _degradedFailureThreshold = 5;
        private long _degradedBackoffMs = 30 * 1000L;

        private long _statsIntervalMs = 30 * 1000L;

        public Builder() {
        }

        private Builder(CrawlSettings settings) {
            _strategy = settings._strategy;
            _concurrentRequests = settings._concurrentRequests;
            _perHostConcurrency = settings._perHostConcurrency;
            _minDelayMs = settings._minDelayMs;
            _maxDelayMs = settings._maxDelayMs;
            _startDelayMs = settings._startDelayMs;
            _targetErrorRate = settings._targetErrorRate;
            _targetLatencyMs = settings._targetLatencyMs;
            _increaseStepMs = settings._increaseStepMs;
            _decreaseFactor = settings._decreaseFactor;
            _retryCap = settings._retryCap;
            _backoffBaseMs = settings._backoffBaseMs;
            _backoffMaxMs = settings._backoffMaxMs;
            _maxDepth = settings._maxDepth;
            _allowedDomains = new ArrayList<>(settings._allowedDomains);
            _proxyEnabled = settings._proxyEnabled;
            _httpProxies = new ArrayList<>(settings._httpProxies);
            _httpsProxies = new ArrayList<>(settings._httpsProxies);
            _proxyRotation = settings._proxyRotation;
            _userAgents = new ArrayList<>(settings._userAgents);
            _robotsCrawlDelay = settings._robotsCrawlDelay;
            _requestTimeoutMs = settings._requestTimeoutMs;
            _maxContentSize = settings._maxContentSize;
            _maxRedirects = settings._maxRedirects;
            _maxOutlinksPerPage = settings._maxOutlinksPerPage;
            _degradedFailureThreshold = settings._degradedFailureThreshold;
            _degradedBackoffMs = settings._degradedBackoffMs;
            _statsIntervalMs = settings._statsIntervalMs;
        }

        public Builder setStrategy(CrawlStrategy strategy) {
            _strategy = strategy;
            return this;
        }

        public Builder setConcurrentRequests(int concurrentRequests) {
            _concurrentRequests = concurrentRequests;
            return this;
        }

        public Builder setPerHostConcurrency(int perHostConcurrency) {
            _perHostConcurrency = perHostConcurrency;
            return this;
        }

        public Builder setMinDelayMs(long minDelayMs) {
            _minDelayMs = minDelayMs;
            return this;
        }

        public Builder setMaxDelayMs(long maxDelayMs) {
            _maxDelayMs = maxDelayMs;
            return this;
        }

        public Builder setStartDelayMs(long startDelayMs) {
            _startDelayMs = startDelayMs;
            return this;
        }

        public Builder setTargetErrorRate(double targetErrorRate) {
            _targetErrorRate = targetErrorRate;
            return this;
        }

        public Builder setTargetLatencyMs(long targetLatencyMs) {
            _targetLatencyMs = targetLatencyMs;
            return this;
        }

        public Builder setIncreaseStepMs(long increaseStepMs) {
            _increaseStepMs = increaseStepMs;
            return this;
        }

        public Builder setDecreaseFactor(double decreaseFactor) {
            _decreaseFactor = decreaseFactor;
            return this;
        }

        public Builder setRetryCap(int retryCap) {
            _retryCap = retryCap;
            return this;
        }

        public Builder setBackoffBaseMs(long backoffBaseMs) {
            _backoffBaseMs = backoffBaseMs;
            return this;
        }

        public Builder setBackoffMaxMs(long backoffMaxMs) {
            _backoffMaxMs = backoffMaxMs;
            return this;
        }

        public Builder setMaxDepth(int maxDepth) {
            _maxDepth = maxDepth;
            return this;
        }

        public Builder setAllowedDomains(List<String> allowedDomains) {
            _allowedDomains = new ArrayList<>(allowedDomains);
            return this;
        }

        public Builder setProxyEnabled(boolean proxyEnabled) {
            _proxyEnabled = proxyEnabled;
            return this;
        }

        public Builder setHttpProxies(List<String> httpProxies) {
            _httpProxies = new ArrayList<>(httpProxies);
            return this;
        }

        public Builder setHttpsProxies(List<String> httpsProxies) {
            _httpsProxies = new ArrayList<>(httpsProxies);
            return this;
        }

        public Builder setProxyRotation(ProxyRotation proxyRotation) {
            _proxyRotation = proxyRotation;
            return this;
        }

        public Builder setUserAgent(String userAgent) {
            _userAgents = new ArrayList<>(Collections.singletonList(userAgent));
            return this;
        }

        public Builder setUserAgents(List<String> userAgents) {
            _userAgents = new ArrayList<>(userAgents);
            return this;
        }

        public Builder setRobotsCrawlDelay(boolean robotsCrawlDelay) {
            _robotsCrawlDelay = robotsCrawlDelay;
            return this;
        }

        public Builder setRequestTimeoutMs(int requestTimeoutMs) {
            _requestTimeoutMs = requestTimeoutMs;
            return this;
        }

        public Builder setMaxContentSize(int maxContentSize) {
            _maxContentSize = maxContentSize;
            return this;
        }

        public Builder setMaxRedirects(int maxRedirects) {
            _maxRedirects = maxRedirects;
            return this;
        }

        public Builder setMaxOutlinksPerPage(int maxOutlinksPerPage) {
            _maxOutlinksPerPage = maxOutlinksPerPage;
            return this;
        }

        public Builder setDegradedFailureThreshold(int degradedFailureThreshold) {
            _degradedFailureThreshold = degradedFailureThreshold;
            return this;
        }

        public Builder setDegradedBackoffMs(long degradedBackoffMs) {
            _degradedBackoffMs = degradedBackoffMs;
            return this;
        }

        public Builder setStatsIntervalMs(long statsIntervalMs) {
            _statsIntervalMs = statsIntervalMs;
            return this;
        }

        /**
         * @return validated settings
         * @throws IllegalArgumentException if any setting is out of range
         */
        public CrawlSettings build() {
            check(_strategy != null, "strategy must be set");
            check(_concurrentRequests >= 1, "concurrentRequests must be at least 1");
            check(_perHostConcurrency >= 1, "perHostConcurrency must be at least 1");
            check(_minDelayMs >= 0, "minDelayMs can't be negative");
            check(_maxDelayMs >= _minDelayMs, "maxDelayMs must be >= minDelayMs");
            check(_startDelayMs >= 0, "startDelayMs can't be negative");
            check((_targetErrorRate >= 0.0) && (_targetErrorRate <= 1.0),
                    "targetErrorRate must be between 0 and 1");
            check(_targetLatencyMs > 0, "targetLatencyMs must be positive");
            check(_increaseStepMs > 0, "increaseStepMs must be positive");
            check((_decreaseFactor > 0.0) && (_decreaseFactor < 1.0),
                    "decreaseFactor must be between 0 and 1 (exclusive)");
            check(_retryCap >= 0, "retryCap can't be negative");
            check(_backoffBaseMs >= 0, "backoffBaseMs can't be negative");
            check(_backoffMaxMs >= _backoffBaseMs, "backoffMaxMs must be >= backoffBaseMs");
            check(_maxDepth >= UNLIMITED_DEPTH, "maxDepth must be -1 (unlimited) or >= 0");
            check(_proxyRotation != null, "proxyRotation must be set");
            check(!_userAgents.isEmpty(), "at least one user agent is required");
            check(_requestTimeoutMs > 0, "requestTimeoutMs must be positive");
            check(_maxContentSize > 0, "maxContentSize must be positive");
            check(_maxRedirects >= 0, "maxRedirects can't be negative");
            check(_maxOutlinksPerPage >= 0, "maxOutlinksPerPage can't be negative");
            check(_degradedFailureThreshold >= 1, "degradedFailureThreshold must be at least 1");
            check(_degradedBackoffMs >= 0, "degradedBackoffMs can't be negative");

            if (_proxyEnabled) {
                check(!_httpProxies.isEmpty() || !_httpsProxies.isEmpty(),
                        "proxies are enabled, but no proxies are configured");
            }

            return new CrawlSettings(this);
        }

        private static void check(boolean condition, String msg) {
            if (!condition) {
                throw new IllegalArgumentException("Invalid crawl settings: " + msg);
            }
        }
    }
}
