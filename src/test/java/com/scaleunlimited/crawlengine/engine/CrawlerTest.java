package com.scaleunlimited.crawlengine.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.scaleunlimited.crawlengine.config.CrawlSettings;
import com.scaleunlimited.crawlengine.config.CrawlTerminator;
import com.scaleunlimited.crawlengine.downloader.Downloader;
import com.scaleunlimited.crawlengine.fetcher.WebGraphFetcher;
import com.scaleunlimited.crawlengine.metrics.CrawlerMetrics;
import com.scaleunlimited.crawlengine.parser.BasePageExtractor;
import com.scaleunlimited.crawlengine.parser.Page;
import com.scaleunlimited.crawlengine.parser.PageParser;
import com.scaleunlimited.crawlengine.parser.ParseRule;
import com.scaleunlimited.crawlengine.parser.RuleCondition;
import com.scaleunlimited.crawlengine.parser.UrlPattern;
import com.scaleunlimited.crawlengine.pipeline.CollectingRecordSink;
import com.scaleunlimited.crawlengine.pipeline.RecordSink;
import com.scaleunlimited.crawlengine.pipeline.RecordSinks;
import com.scaleunlimited.crawlengine.pojos.CrawlEvent;
import com.scaleunlimited.crawlengine.pojos.ExtractedRecord;
import com.scaleunlimited.crawlengine.pojos.FetchContext;
import com.scaleunlimited.crawlengine.scheduler.Scheduler;
import com.scaleunlimited.crawlengine.utils.HttpUtils;
import com.scaleunlimited.crawlengine.utils.TestUrlLogger.UrlLoggerResults;
import com.scaleunlimited.crawlengine.utils.UrlLogger;
import com.scaleunlimited.crawlengine.webgraph.SimpleWebGraph;

public class CrawlerTest {

    @Test
    public void testFollowThenParse() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph()
                .addWithTitle("http://example.test/a", "A", "http://example.test/b")
                .addWithTitle("http://example.test/b", "B");
        WebGraphFetcher fetcher = new WebGraphFetcher(graph);
        CollectingRecordSink sink = new CollectingRecordSink();

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/a")
                .addRule(ParseRule.builder(UrlPattern.allow("/b$"), RuleCondition.BOTH).addField("title", "title"))
                .setSettings(makeSettings().build())
                .setSink(sink)
                .build();

        Crawler crawler = new Crawler(spider, fetcher);
        CrawlSummary summary = crawler.run();

        assertEquals(CrawlState.STOPPED, crawler.getState());
        assertEquals(CrawlState.STOPPED, summary.getFinalState());
        assertEquals(CrawlState.RUNNING, summary.getStoppedFrom());
        assertEquals(2, summary.getCounter(CrawlerMetrics.COUNTER_REQUESTS_DISPATCHED));
        assertEquals(2, summary.getCounter(CrawlerMetrics.COUNTER_FETCH_SUCCESS));

        assertEquals(1, sink.size());
        ExtractedRecord record = sink.getRecords().get(0);
        assertEquals("http://example.test/b", record.getSourceUrl());
        assertEquals("B", record.getString("title"));
    }

    @Test
    public void testUrlActivity() throws Exception {
        UrlLogger.clear();

        SimpleWebGraph graph = new SimpleWebGraph()
                .add("http://example.test/", "http://example.test/a", "http://example.test/gone")
                .addWithTitle("http://example.test/a", "A", "http://example.test/");
        WebGraphFetcher fetcher = new WebGraphFetcher(graph);

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .addRule(ParseRule.follow(".*"))
                .setSettings(makeSettings().build())
                .build();

        new Crawler(spider, fetcher).run();

        UrlLoggerResults results = new UrlLoggerResults(UrlLogger.getLog());
        results.assertLoggedBy(Scheduler.class, 3)
                .assertUrlLoggedBy(Scheduler.class, "http://example.test/a", 1, "depth", "1")
                .assertUrlLoggedBy(Downloader.class, "http://example.test/", 1, "outcome", "SUCCESS")
                .assertUrlLoggedBy(Downloader.class, "http://example.test/gone", 1,
                        "outcome", "SOFT_FAILURE", "status", "CLIENT_ERROR")
                .assertUrlLoggedBy(PageParser.class, "http://example.test/", 1, "links", "2")
                .assertUrlNotLoggedBy(PageParser.class, "http://example.test/gone");
    }

    @Test
    public void testEachPageFetchedOnce() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph()
                .add("http://example.test/", "http://example.test/a", "http://example.test/b")
                .add("http://example.test/a", "http://example.test/", "http://example.test/b",
                        "http://example.test/a?x=1&y=2")
                .add("http://example.test/b", "http://example.test/a", "http://example.test/a?y=2&x=1#frag")
                .add("http://example.test/a?x=1&y=2", "http://example.test/");
        WebGraphFetcher fetcher = new WebGraphFetcher(graph);

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .addRule(ParseRule.follow(".*"))
                .setSettings(makeSettings().build())
                .build();

        CrawlSummary summary = new Crawler(spider, fetcher).run();

        assertEquals(4, fetcher.getFetched().size());
        for (String url : fetcher.getFetched()) {
            assertEquals(1, fetcher.getFetchCount(url));
        }

        assertThat(summary.getCounter(CrawlerMetrics.COUNTER_REJECTED_DUPLICATE)).isGreaterThan(0);
    }

    @Test
    public void testMaxDepthAndDomains() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph()
                .add("http://example.test/0", "http://example.test/1", "http://other.test/1")
                .add("http://example.test/1", "http://example.test/2")
                .add("http://example.test/2", "http://example.test/3")
                .add("http://other.test/1");
        WebGraphFetcher fetcher = new WebGraphFetcher(graph);

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/0")
                .addRule(ParseRule.follow(".*"))
                .setSettings(makeSettings()
                        .setMaxDepth(1)
                        .setAllowedDomains(Collections.singletonList("example.test"))
                        .build())
                .build();

        CrawlSummary summary = new Crawler(spider, fetcher).run();

        assertThat(fetcher.getFetched()).containsExactlyInAnyOrder("http://example.test/0", "http://example.test/1");
        assertEquals(1, summary.getCounter(CrawlerMetrics.COUNTER_REJECTED_DEPTH));
        assertEquals(1, summary.getCounter(CrawlerMetrics.COUNTER_REJECTED_FILTERED));
    }

    @Test
    public void testRedirectIsAdmittedNotParsed() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph()
                .addRedirect("http://example.test/old", 301, "/new")
                .addWithTitle("http://example.test/new", "New");
        WebGraphFetcher fetcher = new WebGraphFetcher(graph);
        CollectingRecordSink sink = new CollectingRecordSink();

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/old")
                .addRule(ParseRule.builder(UrlPattern.allowAll(), RuleCondition.PARSE).addField("title", "title"))
                .setSettings(makeSettings().build())
                .setSink(sink)
                .build();

        CrawlSummary summary = new Crawler(spider, fetcher).run();

        assertEquals(2, fetcher.getFetched().size());
        assertEquals(1, summary.getCounter(CrawlerMetrics.COUNTER_FETCH_REDIRECT));
        assertEquals(1, sink.size());
        assertEquals("http://example.test/new", sink.getRecords().get(0).getSourceUrl());
    }

    @Test
    public void testRetryCap() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph()
                .add("http://example.test/", "http://example.test/busy", "http://example.test/missing")
                .addStatus("http://example.test/busy", 503);
        WebGraphFetcher fetcher = new WebGraphFetcher(graph);
        EventCollector events = new EventCollector();

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .addRule(ParseRule.follow(".*"))
                .setSettings(makeSettings().setRetryCap(2).build())
                .build();

        CrawlSummary summary = new Crawler(spider, fetcher, events, null).run();

        assertEquals(3, fetcher.getFetchCount("http://example.test/busy"));
        assertEquals(1, fetcher.getFetchCount("http://example.test/missing"));
        assertEquals(2, summary.getCounter(CrawlerMetrics.COUNTER_FETCH_RETRY));
        assertEquals(2, summary.getCounter(CrawlerMetrics.COUNTER_RETRIES_SCHEDULED));
        assertEquals(1, summary.getCounter(CrawlerMetrics.COUNTER_FETCH_TERMINAL_FAILURE));
        assertEquals(1, summary.getCounter(CrawlerMetrics.COUNTER_FETCH_SOFT_FAILURE));

        assertEquals(2, events.count(CrawlEvent.Type.FETCH_RETRYABLE));
        assertEquals(1, events.count(CrawlEvent.Type.FETCH_TERMINAL_FAILURE));
        assertEquals(1, events.count(CrawlEvent.Type.FETCH_SOFT));
        assertEquals("http://example.test/missing", events.get(CrawlEvent.Type.FETCH_SOFT).get(0).getUrl());
    }

    @Test
    public void testExtractionFailureIsIsolated() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph()
                .add("http://example.test/", "http://example.test/good", "http://example.test/bad")
                .add("http://example.test/good")
                .add("http://example.test/bad", "http://example.test/hidden")
                .add("http://example.test/hidden");
        WebGraphFetcher fetcher = new WebGraphFetcher(graph);
        CollectingRecordSink sink = new CollectingRecordSink();
        EventCollector events = new EventCollector();

        BasePageExtractor extractor = new BasePageExtractor() {

            @Override
            public List<ExtractedRecord> extract(Page page) throws Exception {
                if (page.getUrl().endsWith("/bad")) {
                    throw new IllegalStateException("Can't handle " + page.getUrl());
                }

                return Collections.singletonList(new ExtractedRecord(page.getUrl(), 0).put("url", page.getUrl()));
            }
        };

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .addRule(ParseRule.builder(UrlPattern.allowAll(), RuleCondition.BOTH).addPageExtractor(extractor))
                .setSettings(makeSettings().build())
                .setSink(sink)
                .build();

        CrawlSummary summary = new Crawler(spider, fetcher, events, null).run();

        assertEquals(CrawlState.RUNNING, summary.getStoppedFrom());
        assertEquals(2, sink.size());
        assertEquals(1, events.count(CrawlEvent.Type.EXTRACTION_FAILURE));
        assertEquals("http://example.test/bad", events.get(CrawlEvent.Type.EXTRACTION_FAILURE).get(0).getUrl());

        // Nothing from a page that failed extraction is followed.
        assertEquals(0, fetcher.getFetchCount("http://example.test/hidden"));
    }

    @Test
    public void testSinkFailureIsIsolated() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph()
                .addWithTitle("http://example.test/", "Home", "http://example.test/a")
                .addWithTitle("http://example.test/a", "Fail");
        WebGraphFetcher fetcher = new WebGraphFetcher(graph);
        final CollectingRecordSink collector = new CollectingRecordSink();
        EventCollector events = new EventCollector();

        RecordSink sink = new RecordSink() {

            @Override
            public void accept(ExtractedRecord record) throws Exception {
                if ("Fail".equals(record.getString("title"))) {
                    throw new Exception("Can't store record");
                }

                collector.accept(record);
            }
        };

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .addRule(ParseRule.builder(UrlPattern.allowAll(), RuleCondition.BOTH).addField("title", "title"))
                .setSettings(makeSettings().build())
                .setSink(sink)
                .build();

        CrawlSummary summary = new Crawler(spider, fetcher, events, null).run();

        assertEquals(1, collector.size());
        assertEquals(1, summary.getCounter(CrawlerMetrics.COUNTER_RECORDS_SINK_FAILED));
        assertEquals(1, events.count(CrawlEvent.Type.SINK_FAILURE));
    }

    @Test
    public void testCriticalSinkFailureStopsCrawl() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph()
                .addWithTitle("http://example.test/", "Home", "http://example.test/a")
                .addWithTitle("http://example.test/a", "A");
        WebGraphFetcher fetcher = new WebGraphFetcher(graph);

        RecordSink sink = RecordSinks.critical(new RecordSink() {

            @Override
            public void accept(ExtractedRecord record) throws Exception {
                throw new Exception("Database is gone");
            }
        });

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .addRule(ParseRule.builder(UrlPattern.allowAll(), RuleCondition.BOTH).addField("title", "title"))
                .setSettings(makeSettings().build())
                .setSink(sink)
                .build();

        Crawler crawler = new Crawler(spider, fetcher);
        try {
            crawler.run();
            fail("Should have thrown exception");
        } catch (CrawlException e) {
            assertEquals("Database is gone", e.getCause().getMessage());
            assertEquals(CrawlState.STOPPED, e.getSummary().getFinalState());
            assertEquals(CrawlState.CANCELLING, e.getSummary().getStoppedFrom());
        }

        assertEquals(CrawlState.STOPPED, crawler.getState());
    }

    @Test
    public void testStopDrainsInFlightFetches() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph()
                .add("http://example.test/", "http://example.test/next")
                .add("http://example.test/next")
                .setDelay("http://example.test/", 500);
        WebGraphFetcher fetcher = new WebGraphFetcher(graph);

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .addRule(ParseRule.follow(".*"))
                .setSettings(makeSettings().build())
                .build();

        Crawler crawler = new Crawler(spider, fetcher);
        Future<CrawlSummary> result = crawler.start();
        waitForFetch(fetcher, "http://example.test/");

        assertTrue(crawler.stop(10000));
        assertFalse(crawler.stop(10000));

        CrawlSummary summary = result.get(10, TimeUnit.SECONDS);
        assertEquals(CrawlState.DRAINING, summary.getStoppedFrom());
        assertEquals(1, summary.getCounter(CrawlerMetrics.COUNTER_FETCH_SUCCESS));
        assertEquals(0, summary.getCounter(CrawlerMetrics.COUNTER_FETCH_CANCELLED));

        // The in-flight fetch finished, but nothing new was dispatched.
        assertEquals(0, fetcher.getFetchCount("http://example.test/next"));
    }

    @Test
    public void testGracePeriodExpires() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph()
                .add("http://example.test/")
                .setDelay("http://example.test/", 20000);
        WebGraphFetcher fetcher = new WebGraphFetcher(graph);

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .setSettings(makeSettings().build())
                .build();

        Crawler crawler = new Crawler(spider, fetcher);
        Future<CrawlSummary> result = crawler.start();
        waitForFetch(fetcher, "http://example.test/");

        long startTime = System.currentTimeMillis();
        crawler.stop(100);

        CrawlSummary summary = result.get(10, TimeUnit.SECONDS);
        assertThat(System.currentTimeMillis() - startTime).isLessThan(10000L);
        assertEquals(CrawlState.DRAINING, summary.getStoppedFrom());
        assertEquals(1, summary.getCounter(CrawlerMetrics.COUNTER_FETCH_CANCELLED));
        assertEquals(0, summary.getCounter(CrawlerMetrics.COUNTER_FETCH_SUCCESS));
        assertEquals(1, fetcher.getNumAborts());
    }

    @Test
    public void testCancel() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph()
                .add("http://example.test/a")
                .add("http://example.test/b")
                .setDelay("http://example.test/a", 20000)
                .setDelay("http://example.test/b", 20000);
        WebGraphFetcher fetcher = new WebGraphFetcher(graph);
        EventCollector events = new EventCollector();

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/a")
                .addStartUrl("http://example.test/b")
                .setSettings(makeSettings().build())
                .build();

        Crawler crawler = new Crawler(spider, fetcher, events, null);
        Future<CrawlSummary> result = crawler.start();
        waitForFetch(fetcher, "http://example.test/a");
        waitForFetch(fetcher, "http://example.test/b");

        crawler.cancel();

        CrawlSummary summary = result.get(10, TimeUnit.SECONDS);
        assertEquals(CrawlState.CANCELLING, summary.getStoppedFrom());
        assertEquals(2, summary.getCounter(CrawlerMetrics.COUNTER_FETCH_CANCELLED));
        assertEquals(CrawlState.STOPPED, crawler.getState());

        // Cancelled fetches are reported once, and not routed as normal outcomes.
        assertEquals(0, events.count(CrawlEvent.Type.FETCH_TERMINAL_FAILURE));
        assertEquals(0, summary.getCounter(CrawlerMetrics.COUNTER_FETCH_TERMINAL_FAILURE));

        // No-op once stopped.
        crawler.cancel();
        assertFalse(crawler.stop(0));
    }

    @Test
    public void testTerminator() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph().add("http://example.test/");
        WebGraphFetcher fetcher = new WebGraphFetcher(graph);

        CrawlTerminator terminator = new CrawlTerminator() {

            @Override
            public boolean isTerminated() {
                return true;
            }
        };

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .setSettings(makeSettings().build())
                .build();

        CrawlSummary summary = new Crawler(spider, fetcher, null, terminator).run();
        assertEquals(CrawlState.DRAINING, summary.getStoppedFrom());
        assertTrue(fetcher.getFetched().isEmpty());
    }

    @Test
    public void testRunsOnlyOnce() throws Exception {
        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .setSettings(makeSettings().build())
                .build();
        Crawler crawler = new Crawler(spider, new WebGraphFetcher(new SimpleWebGraph().add("http://example.test/")));
        crawler.run();

        try {
            crawler.run();
            fail("Should have thrown exception");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void testCancelBeforeRun() throws Exception {
        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .setSettings(makeSettings().build())
                .build();
        Crawler crawler = new Crawler(spider, new WebGraphFetcher(new SimpleWebGraph()));
        crawler.cancel();
        assertEquals(CrawlState.STOPPED, crawler.getState());

        try {
            crawler.run();
            fail("Should have thrown exception");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void testConcurrencyLimits() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph();
        List<String> pages = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            pages.add("http://example.test/" + i);
        }

        graph.add("http://example.test/", pages.toArray(new String[pages.size()]));
        for (String page : pages) {
            graph.add(page);
            graph.setDelay(page, 50);
        }

        WebGraphFetcher fetcher = new WebGraphFetcher(graph);
        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .addRule(ParseRule.follow(".*"))
                .setSettings(makeSettings().setConcurrentRequests(8).setPerHostConcurrency(2).build())
                .build();

        new Crawler(spider, fetcher).run();

        assertEquals(13, fetcher.getFetched().size());
        assertThat(fetcher.getMaxActivePerHost()).isBetween(1, 2);
    }

    @Test
    public void testSinkCallsAreSerialized() throws Exception {
        SimpleWebGraph graph = new SimpleWebGraph();
        List<String> pages = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            pages.add("http://host" + i + ".test/");
        }

        graph.add("http://start.test/", pages.toArray(new String[pages.size()]));
        for (String page : pages) {
            graph.addWithTitle(page, "Title " + page);
        }

        WebGraphFetcher fetcher = new WebGraphFetcher(graph);
        final AtomicInteger active = new AtomicInteger();
        final AtomicInteger maxActive = new AtomicInteger();
        final AtomicInteger accepted = new AtomicInteger();

        RecordSink sink = new RecordSink() {

            @Override
            public void accept(ExtractedRecord record) throws Exception {
                int nowActive = active.incrementAndGet();
                synchronized (maxActive) {
                    maxActive.set(Math.max(maxActive.get(), nowActive));
                }

                Thread.sleep(100);
                accepted.incrementAndGet();
                active.decrementAndGet();
            }
        };

        Spider spider = Spider.builder()
                .addStartUrl("http://start.test/")
                .addRule(ParseRule.follow(".*"))
                .addRule(ParseRule.builder(UrlPattern.allow("host"), RuleCondition.PARSE).addField("title", "title"))
                .setSettings(makeSettings().setConcurrentRequests(8).build())
                .setSink(sink)
                .build();

        new Crawler(spider, fetcher).run();

        assertEquals(8, accepted.get());
        assertEquals(1, maxActive.get());
    }

    @Test
    public void testMiddlewareIsApplied() throws Exception {
        WebGraphFetcher fetcher = new WebGraphFetcher(new SimpleWebGraph().add("http://example.test/"));
        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .setSettings(makeSettings().setUserAgent("testbot/1.0").build())
                .build();

        new Crawler(spider, fetcher).run();

        FetchContext context = fetcher.getContexts().get(0);
        assertEquals("testbot/1.0", context.getHeader(HttpUtils.USER_AGENT));
        assertNotNull(context.getHeader(HttpUtils.ACCEPT));
    }

    @Test
    public void testListenerFailuresAreIgnored() throws Exception {
        WebGraphFetcher fetcher = new WebGraphFetcher(new SimpleWebGraph()
                .add("http://example.test/", "http://example.test/missing"));
        CrawlEventListener listener = new CrawlEventListener() {

            @Override
            public void onEvent(CrawlEvent event) {
                throw new RuntimeException("Listener is broken");
            }
        };

        Spider spider = Spider.builder()
                .addStartUrl("http://example.test/")
                .addRule(ParseRule.follow(".*"))
                .setSettings(makeSettings().build())
                .build();

        CrawlSummary summary = new Crawler(spider, fetcher, listener, null).run();
        assertEquals(CrawlState.RUNNING, summary.getStoppedFrom());
        assertEquals(1, summary.getCounter(CrawlerMetrics.COUNTER_FETCH_SOFT_FAILURE));
    }

    private static CrawlSettings.Builder makeSettings() {
        return CrawlSettings.builder()
                .setStartDelayMs(0)
                .setMinDelayMs(0)
                .setIncreaseStepMs(10)
                .setBackoffBaseMs(10)
                .setBackoffMaxMs(50)
                .setConcurrentRequests(4)
                .setStatsIntervalMs(100);
    }

    private static void waitForFetch(WebGraphFetcher fetcher, String url) throws InterruptedException {
        long endTime = System.currentTimeMillis() + 10000;
        while (fetcher.getFetchCount(url) == 0) {
            if (System.currentTimeMillis() > endTime) {
                fail("Timed out waiting for fetch of " + url);
            }

            Thread.sleep(10);
        }
    }

    private static class EventCollector implements CrawlEventListener {

        private final List<CrawlEvent> _events = new ArrayList<>();

        @Override
        public synchronized void onEvent(CrawlEvent event) {
            _events.add(event);
        }

        public synchronized List<CrawlEvent> get(CrawlEvent.Type type) {
            List<CrawlEvent> result = new ArrayList<>();
            for (CrawlEvent event : _events) {
                if (event.getType() == type) {
                    result.add(event);
                }
            }

            return result;
        }

        public int count(CrawlEvent.Type type) {
            return get(type).size();
        }
    }
}
