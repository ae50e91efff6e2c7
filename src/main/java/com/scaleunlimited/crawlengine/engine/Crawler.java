package com.scaleunlimited.crawlengine.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.crawlengine.config.CrawlSettings;
import com.scaleunlimited.crawlengine.config.CrawlTerminator;
import com.scaleunlimited.crawlengine.crawldb.BaseFingerprintStore;
import com.scaleunlimited.crawlengine.crawldb.InMemoryFingerprintStore;
import com.scaleunlimited.crawlengine.downloader.BaseDownloaderMiddleware;
import com.scaleunlimited.crawlengine.downloader.Downloader;
import com.scaleunlimited.crawlengine.downloader.middleware.AutoThrottleMiddleware;
import com.scaleunlimited.crawlengine.downloader.middleware.DefaultHeadersMiddleware;
import com.scaleunlimited.crawlengine.downloader.middleware.ProxyMiddleware;
import com.scaleunlimited.crawlengine.downloader.middleware.RobotsMiddleware;
import com.scaleunlimited.crawlengine.downloader.middleware.UserAgentMiddleware;
import com.scaleunlimited.crawlengine.fetcher.BaseHttpFetcher;
import com.scaleunlimited.crawlengine.fetcher.HttpClientFetcherBuilder;
import com.scaleunlimited.crawlengine.metrics.CrawlerAccumulator;
import com.scaleunlimited.crawlengine.metrics.CrawlerMetrics;
import com.scaleunlimited.crawlengine.metrics.TimedCounter;
import com.scaleunlimited.crawlengine.parser.PageParser;
import com.scaleunlimited.crawlengine.pipeline.RecordSink;
import com.scaleunlimited.crawlengine.pipeline.RecordSinks;
import com.scaleunlimited.crawlengine.pojos.CrawlEvent;
import com.scaleunlimited.crawlengine.pojos.CrawlRequest;
import com.scaleunlimited.crawlengine.pojos.ExtractedRecord;
import com.scaleunlimited.crawlengine.scheduler.AdmissionResult;
import com.scaleunlimited.crawlengine.scheduler.Scheduler;
import com.scaleunlimited.crawlengine.throttle.AutoThrottle;
import com.scaleunlimited.crawlengine.urls.BaseUrlValidator;
import com.scaleunlimited.crawlengine.urls.DomainUrlValidator;
import com.scaleunlimited.crawlengine.urls.SimpleUrlValidator;
import com.scaleunlimited.crawlengine.utils.ThreadedExecutor;

/**
 * Drives one crawl: pulls requests from the {@link Scheduler}, runs each one as
 * a {@link FetchTask} on a bounded pool, and keeps going until the scheduler is
 * quiescent, the crawl is stopped, or it's cancelled.
 *
 * A crawler runs once. State goes IDLE, RUNNING, then optionally DRAINING or
 * CANCELLING, and always ends in STOPPED.
 */
public class Crawler {
    private static final Logger LOGGER = LoggerFactory.getLogger(Crawler.class);

    private static final long MAX_WAIT_MS = 100L;
    private static final long TERMINATION_WAIT_MS = 5000L;
    private static final int FETCH_RATE_WINDOW_SECONDS = 10;

    public static final long NO_DRAIN_LIMIT = Long.MAX_VALUE;

    private static final CrawlEventListener NO_OP_LISTENER = new CrawlEventListener() {

        @Override
        public void onEvent(CrawlEvent event) {
        }
    };

    private final Spider _spider;
    private final BaseHttpFetcher _fetcher;
    private final CrawlEventListener _listener;
    private final CrawlTerminator _terminator;
    private final CrawlerAccumulator _accumulator;
    private final TimedCounter _fetchRate;

    private final AtomicReference<CrawlState> _state;
    private final AtomicReference<Throwable> _fatalError;
    private final Map<CrawlRequest, FetchTask> _activeTasks;
    private final Object _sinkLock;
    private volatile long _drainDeadline;

    // Created when the crawl starts.
    private volatile Scheduler _scheduler;
    private Downloader _downloader;
    private PageParser _parser;
    private ThreadedExecutor _executor;

    public Crawler(Spider spider) {
        this(spider, makeFetcher(spider.getSettings()));
    }

    public Crawler(Spider spider, BaseHttpFetcher fetcher) {
        this(spider, fetcher, null, null);
    }

    /**
     * @param listener gets crawl events, or null
     * @param terminator decides when to start draining, or null to run until the
     *        frontier is exhausted
     */
    public Crawler(Spider spider, BaseHttpFetcher fetcher, CrawlEventListener listener,
            CrawlTerminator terminator) {
        _spider = spider;
        _fetcher = fetcher;
        _listener = (listener == null) ? NO_OP_LISTENER : listener;
        _terminator = terminator;
        _accumulator = new CrawlerAccumulator();
        _fetchRate = new TimedCounter(FETCH_RATE_WINDOW_SECONDS);

        _state = new AtomicReference<>(CrawlState.IDLE);
        _fatalError = new AtomicReference<>();
        _activeTasks = Collections.synchronizedMap(new IdentityHashMap<CrawlRequest, FetchTask>());
        _sinkLock = new Object();
        _drainDeadline = NO_DRAIN_LIMIT;
    }

    /**
     * @return an HttpClient-based fetcher configured from <settings>
     */
    public static BaseHttpFetcher makeFetcher(CrawlSettings settings) {
        return new HttpClientFetcherBuilder(settings.getConcurrentRequests())
                .setTimeoutMs(settings.getRequestTimeoutMs())
                .setMaxContentSize(settings.getMaxContentSize())
                .setMaxConnectionsPerHost(settings.getPerHostConcurrency())
                .build();
    }

    /**
     * Run the crawl on a background thread.
     */
    public Future<CrawlSummary> start() {
        FutureTask<CrawlSummary> result = new FutureTask<>(new Callable<CrawlSummary>() {

            @Override
            public CrawlSummary call() throws Exception {
                return run();
            }
        });

        Thread t = new Thread(result, "crawler-" + _spider.getName());
        t.setDaemon(true);
        t.start();
        return result;
    }

    /**
     * Run the crawl, blocking until it's stopped.
     *
     * @throws IllegalStateException if this crawler has already been run
     * @throws CrawlException if the crawl was stopped by a fatal error
     */
    public CrawlSummary run() throws CrawlException {
        if (!_state.compareAndSet(CrawlState.IDLE, CrawlState.RUNNING)) {
            throw new IllegalStateException("Crawler can't be run when " + _state.get());
        }

        long startTime = System.currentTimeMillis();
        CrawlSettings settings = _spider.getSettings();
        LOGGER.info("Starting crawl for {} using {} strategy", _spider, settings.getStrategy());

        BaseFingerprintStore fingerprintStore = new InMemoryFingerprintStore();
        CrawlState stoppedFrom;
        try {
            fingerprintStore.open();
            open(settings, fingerprintStore);

            int numAdmitted = _scheduler.admitAll(_spider.getStartRequests());
            LOGGER.info("Admitted {} of {} start requests", numAdmitted, _spider.getStartRequests().size());

            if (_terminator != null) {
                _terminator.open();
            }

            crawl(settings);
        } catch (InterruptedException e) {
            LOGGER.warn("Crawl interrupted, cancelling in-flight fetches");
            _state.set(CrawlState.CANCELLING);
            cancelActiveFetches();
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            LOGGER.error("Crawl failed", e);
            _fatalError.compareAndSet(null, e);
            _state.set(CrawlState.CANCELLING);
            cancelActiveFetches();
        } finally {
            stoppedFrom = _state.get();
            close(fingerprintStore);
            _state.set(CrawlState.STOPPED);
        }

        CrawlSummary summary = new CrawlSummary(CrawlState.STOPPED, stoppedFrom, startTime,
                System.currentTimeMillis(), _accumulator.snapshot());
        LOGGER.info(summary.toString());

        Throwable fatalError = _fatalError.get();
        if (fatalError != null) {
            throw new CrawlException("Crawl stopped by fatal error: " + fatalError.getMessage(),
                    fatalError, summary);
        }

        return summary;
    }

    private void open(CrawlSettings settings, BaseFingerprintStore fingerprintStore) {
        AutoThrottle autoThrottle = new AutoThrottle(settings);
        BaseUrlValidator validator = settings.getAllowedDomains().isEmpty() ? new SimpleUrlValidator()
                : new DomainUrlValidator(settings.getAllowedDomains());

        _scheduler = new Scheduler(settings, fingerprintStore, validator, autoThrottle, _accumulator);
        _downloader = new Downloader(_fetcher, makeMiddleware(settings, autoThrottle), settings);
        _parser = new PageParser(settings.getMaxOutlinksPerPage(), _accumulator);
        _executor = new ThreadedExecutor("fetcher", settings.getConcurrentRequests());
    }

    /**
     * Built-in middleware, in order, followed by whatever the spider adds.
     */
    protected List<BaseDownloaderMiddleware> makeMiddleware(CrawlSettings settings, AutoThrottle autoThrottle) {
        List<BaseDownloaderMiddleware> result = new ArrayList<>();
        result.add(new DefaultHeadersMiddleware());
        result.add(new UserAgentMiddleware(settings.getUserAgents()));

        if (settings.isProxyEnabled()) {
            result.add(new ProxyMiddleware(settings));
        }

        if (settings.isRobotsCrawlDelay()) {
            result.add(new RobotsMiddleware(_fetcher, autoThrottle, settings.getUserAgents().get(0)));
        }

        result.add(new AutoThrottleMiddleware(autoThrottle));
        result.addAll(_spider.getMiddleware());
        return result;
    }

    private void crawl(CrawlSettings settings) throws InterruptedException {
        long statsInterval = settings.getStatsIntervalMs();
        long nextStatsTime = System.currentTimeMillis() + statsInterval;

        while (true) {
            CrawlState state = _state.get();
            long now = System.currentTimeMillis();
            if (now >= nextStatsTime) {
                logStats(now);
                nextStatsTime = now + statsInterval;
            }

            if (state == CrawlState.CANCELLING) {
                cancelActiveFetches();
                break;
            } else if (state == CrawlState.DRAINING) {
                if (_scheduler.getInFlightCount() == 0) {
                    LOGGER.info("Drained all in-flight fetches");
                    break;
                }

                if (now >= _drainDeadline) {
                    LOGGER.warn("Grace period expired with {} fetches in flight, cancelling them",
                            _scheduler.getInFlightCount());
                    cancelActiveFetches();
                    break;
                }

                _scheduler.awaitSignal(Math.min(MAX_WAIT_MS, _drainDeadline - now));
            } else if ((_terminator != null) && _terminator.isTerminated()) {
                stop(NO_DRAIN_LIMIT);
            } else if (_scheduler.isQuiescent()) {
                LOGGER.info("Frontier is empty and nothing is in flight");
                break;
            } else {
                int maxInFlight = settings.getConcurrentRequests();
                if (!dispatch(maxInFlight)) {
                    if (_scheduler.getInFlightCount() >= maxInFlight) {
                        _scheduler.awaitSignal(MAX_WAIT_MS);
                    } else {
                        _scheduler.awaitChange(MAX_WAIT_MS);
                    }
                }
            }
        }
    }

    /**
     * Dispatch as many eligible requests as the concurrency budget allows.
     *
     * @return true if anything was dispatched
     */
    private boolean dispatch(int maxInFlight) {
        boolean result = false;
        while (_scheduler.getInFlightCount() < maxInFlight) {
            CrawlRequest request = _scheduler.next();
            if (request == null) {
                break;
            }

            FetchTask task = new FetchTask(this, request);
            _activeTasks.put(request, task);
            try {
                task.setFuture(_executor.submit(task));
            } catch (RejectedExecutionException e) {
                LOGGER.warn("Fetch of {} was rejected by the executor", request.getUrl());
                task.cancel();
            }

            result = true;
        }

        return result;
    }

    private void cancelActiveFetches() {
        List<FetchTask> tasks;
        synchronized (_activeTasks) {
            tasks = new ArrayList<>(_activeTasks.values());
        }

        for (FetchTask task : tasks) {
            task.cancel();
        }

        if (_downloader != null) {
            _downloader.abort();
        }

        if (!tasks.isEmpty()) {
            LOGGER.info("Cancelled {} in-flight fetches", tasks.size());
        }
    }

    private void close(BaseFingerprintStore fingerprintStore) {
        if (_scheduler != null) {
            int numDropped = _scheduler.clearFrontier();
            if (numDropped > 0) {
                LOGGER.info("Dropped {} queued requests", numDropped);
            }
        }

        if (_executor != null) {
            try {
                if (!_executor.terminate(TERMINATION_WAIT_MS, TimeUnit.MILLISECONDS)) {
                    LOGGER.warn("Had to interrupt fetch threads during shutdown");
                }
            } catch (InterruptedException e) {
                _executor.terminateNow();
                Thread.currentThread().interrupt();
            }
        }

        if (_downloader != null) {
            _downloader.close();
        }

        try {
            fingerprintStore.close();
        } catch (Exception e) {
            LOGGER.warn("Error closing fingerprint store", e);
        }
    }

    private void logStats(long now) {
        LOGGER.info(String.format(
                "%s: queued %d, in flight %d, fetched %d (%d ok, %d failed), %d records, %.1f fetches/sec",
                _state.get(), _scheduler.getQueueSize(), _scheduler.getInFlightCount(),
                _accumulator.getValue(CrawlerMetrics.COUNTER_REQUESTS_DISPATCHED),
                _accumulator.getValue(CrawlerMetrics.COUNTER_FETCH_SUCCESS),
                _accumulator.getValue(CrawlerMetrics.COUNTER_FETCH_TERMINAL_FAILURE)
                        + _accumulator.getValue(CrawlerMetrics.COUNTER_FETCH_SOFT_FAILURE),
                _accumulator.getValue(CrawlerMetrics.COUNTER_RECORDS_EXTRACTED),
                _fetchRate.getRate(now)));
    }

    /**
     * Stop dispatching, and give in-flight fetches up to <graceMs> to finish
     * before they're cancelled. Returns immediately.
     *
     * @return true if the crawl was running and is now draining
     */
    public boolean stop(long graceMs) {
        long now = System.currentTimeMillis();
        _drainDeadline = (graceMs == NO_DRAIN_LIMIT) ? NO_DRAIN_LIMIT : now + graceMs;
        if (_state.compareAndSet(CrawlState.RUNNING, CrawlState.DRAINING)) {
            LOGGER.info("Draining crawl");
            wakeUp();
            return true;
        }

        return false;
    }

    /**
     * Cancel in-flight fetches (reported as timeouts) and stop. Returns
     * immediately.
     */
    public void cancel() {
        while (true) {
            CrawlState state = _state.get();
            if (state == CrawlState.IDLE) {
                if (_state.compareAndSet(state, CrawlState.STOPPED)) {
                    return;
                }
            } else if ((state == CrawlState.RUNNING) || (state == CrawlState.DRAINING)) {
                if (_state.compareAndSet(state, CrawlState.CANCELLING)) {
                    LOGGER.info("Cancelling crawl");
                    wakeUp();
                    return;
                }
            } else {
                return;
            }
        }
    }

    public CrawlState getState() {
        return _state.get();
    }

    public CrawlerAccumulator getAccumulator() {
        return _accumulator;
    }

    private void wakeUp() {
        Scheduler scheduler = _scheduler;
        if (scheduler != null) {
            scheduler.wakeUp();
        }
    }

    // Used by fetch tasks.

    Spider getSpider() {
        return _spider;
    }

    Scheduler getScheduler() {
        return _scheduler;
    }

    Downloader getDownloader() {
        return _downloader;
    }

    PageParser getParser() {
        return _parser;
    }

    TimedCounter getFetchRate() {
        return _fetchRate;
    }

    void admit(CrawlRequest request) {
        AdmissionResult result = _scheduler.admit(request);
        if (!result.isAdmitted()) {
            notify(new CrawlEvent(CrawlEvent.Type.ADMISSION_REJECTED, request.getUrl(), result.name()));
        }
    }

    /**
     * Hand the records extracted from <url> to the spider's sink. Only one
     * page's records are delivered at a time, in extraction order, so sinks
     * never see concurrent calls.
     */
    void deliver(String url, List<ExtractedRecord> records) {
        RecordSink sink = _spider.getSink();
        synchronized (_sinkLock) {
            for (ExtractedRecord record : records) {
                if (isCancelling()) {
                    LOGGER.debug("Skipping remaining records for {}, crawl is being cancelled", url);
                    return;
                }

                try {
                    sink.accept(record);
                } catch (Exception e) {
                    if (RecordSinks.isCritical(sink)) {
                        fail(e);
                        return;
                    }

                    _accumulator.increment(CrawlerMetrics.COUNTER_RECORDS_SINK_FAILED);
                    LOGGER.error("Sink failed for record from " + url, e);
                    notify(new CrawlEvent(CrawlEvent.Type.SINK_FAILURE, url, e.getMessage(), e));
                }
            }
        }
    }

    void notify(CrawlEvent event) {
        try {
            _listener.onEvent(event);
        } catch (RuntimeException e) {
            LOGGER.warn("Event listener failed on " + event, e);
        }
    }

    /**
     * Stop the crawl because of an unrecoverable error.
     */
    void fail(Throwable cause) {
        if (_fatalError.compareAndSet(null, cause)) {
            LOGGER.error("Fatal error, cancelling crawl", cause);
        }

        cancel();
    }

    boolean isCancelling() {
        return _state.get() == CrawlState.CANCELLING;
    }

    void taskFinished(FetchTask task) {
        _activeTasks.remove(task.getRequest());
    }
}
