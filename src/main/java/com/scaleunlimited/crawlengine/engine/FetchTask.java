package com.scaleunlimited.crawlengine.engine;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.crawlengine.metrics.CrawlerAccumulator;
import com.scaleunlimited.crawlengine.metrics.CrawlerMetrics;
import com.scaleunlimited.crawlengine.parser.ExtractionException;
import com.scaleunlimited.crawlengine.parser.ParserResult;
import com.scaleunlimited.crawlengine.pojos.CrawlEvent;
import com.scaleunlimited.crawlengine.pojos.CrawlRequest;
import com.scaleunlimited.crawlengine.pojos.FetchOutcome;
import com.scaleunlimited.crawlengine.pojos.ResponseStatus;

/**
 * One in-flight request: fetch, route the outcome, then report it to the
 * scheduler. The outcome is reported exactly once, either by the task itself
 * or by {@link #cancel()}.
 */
class FetchTask implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(FetchTask.class);

    private final Crawler _crawler;
    private final CrawlRequest _request;
    private final AtomicBoolean _reported;
    private volatile Future<?> _future;

    public FetchTask(Crawler crawler, CrawlRequest request) {
        _crawler = crawler;
        _request = request;
        _reported = new AtomicBoolean(false);
    }

    public CrawlRequest getRequest() {
        return _request;
    }

    public void setFuture(Future<?> future) {
        _future = future;
    }

    @Override
    public void run() {
        FetchOutcome outcome = null;
        try {
            outcome = _crawler.getDownloader().fetch(_request);
            _crawler.getFetchRate().increment();

            if (!_reported.get()) {
                handleOutcome(outcome);
            }
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error processing " + _request.getUrl(), e);
            if (outcome == null) {
                outcome = FetchOutcome.terminalFailure(ResponseStatus.NETWORK_ERROR, null, 0,
                        "Unexpected error: " + e.getMessage());
            }
        } finally {
            if (outcome == null) {
                outcome = FetchOutcome.terminalFailure(ResponseStatus.NETWORK_ERROR, null, 0,
                        "Fetch task failed");
            }

            report(outcome);
            _crawler.taskFinished(this);
        }
    }

    /**
     * Report the request as timed out, and interrupt the fetch if it's running.
     */
    public void cancel() {
        if (report(FetchOutcome.terminalFailure(ResponseStatus.TIMEOUT, null, 0, "Fetch cancelled"))) {
            _crawler.getAccumulator().increment(CrawlerMetrics.COUNTER_FETCH_CANCELLED);
        }

        Future<?> future = _future;
        if (future != null) {
            future.cancel(true);
        }

        _crawler.taskFinished(this);
    }

    private boolean report(FetchOutcome outcome) {
        if (_reported.compareAndSet(false, true)) {
            _crawler.getScheduler().reportOutcome(_request, outcome);
            return true;
        } else {
            return false;
        }
    }

    private void handleOutcome(FetchOutcome outcome) {
        CrawlerAccumulator accumulator = _crawler.getAccumulator();
        String url = _request.getUrl();

        switch (outcome.getKind()) {
            case SUCCESS:
                accumulator.increment(CrawlerMetrics.COUNTER_FETCH_SUCCESS);
                processPage(outcome);
                break;

            case REDIRECT:
                accumulator.increment(CrawlerMetrics.COUNTER_FETCH_REDIRECT);
                LOGGER.debug("Redirect from {} to {}", url, outcome.getRedirectUrl());
                _crawler.admit(_request.makeRedirect(outcome.getRedirectUrl()));
                break;

            case SOFT_FAILURE:
                accumulator.increment(CrawlerMetrics.COUNTER_FETCH_SOFT_FAILURE);
                LOGGER.debug("Soft failure for {}: {}", url, outcome.getReason());
                _crawler.notify(new CrawlEvent(CrawlEvent.Type.FETCH_SOFT, url, outcome.getReason()));
                break;

            case RETRY:
                accumulator.increment(CrawlerMetrics.COUNTER_FETCH_RETRY);
                LOGGER.debug("Will retry {} in {}ms: {}", url, outcome.getRetryDelayMs(), outcome.getReason());
                _crawler.notify(new CrawlEvent(CrawlEvent.Type.FETCH_RETRYABLE, url, outcome.getReason()));
                break;

            case TERMINAL_FAILURE:
                accumulator.increment(CrawlerMetrics.COUNTER_FETCH_TERMINAL_FAILURE);
                LOGGER.warn("Giving up on {}: {}", url, outcome.getReason());
                _crawler.notify(new CrawlEvent(CrawlEvent.Type.FETCH_TERMINAL_FAILURE, url, outcome.getReason()));
                break;

            default:
                throw new RuntimeException("Unknown outcome kind: " + outcome.getKind());
        }
    }

    private void processPage(FetchOutcome outcome) {
        String url = _request.getUrl();
        Spider spider = _crawler.getSpider();

        ParserResult result;
        try {
            result = _crawler.getParser().parse(outcome.getResponse(), spider.getRules());
        } catch (ExtractionException e) {
            LOGGER.warn("Extraction failed for {}: {}", url, e.getMessage());
            _crawler.notify(new CrawlEvent(CrawlEvent.Type.EXTRACTION_FAILURE, url, e.getMessage(), e));
            return;
        }

        for (CrawlRequest child : result.getRequests()) {
            _crawler.admit(child);
        }

        _crawler.deliver(url, result.getRecords());
    }
}
