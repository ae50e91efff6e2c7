package com.scaleunlimited.crawlengine.scheduler;

import static org.junit.Assert.*;

import org.junit.Test;

import com.scaleunlimited.crawlengine.pojos.CrawlRequest;

public class FrontierTest {

    @Test
    public void testPriorityThenInsertionOrder() {
        Frontier frontier = new Frontier();
        frontier.add(makeEntry("http://a.com/1", "a.com", 0.0, 0));
        frontier.add(makeEntry("http://a.com/2", "a.com", 1.0, 1));
        frontier.add(makeEntry("http://b.com/3", "b.com", 0.0, 2));
        frontier.add(makeEntry("http://b.com/4", "b.com", 1.0, 3));

        assertEquals(4, frontier.size());
        assertEquals(2, frontier.getHostSize("a.com"));

        assertEquals("http://a.com/2", frontier.poll().getRequest().getUrl());
        assertEquals("http://b.com/4", frontier.poll().getRequest().getUrl());
        assertEquals("http://a.com/1", frontier.poll().getRequest().getUrl());
        assertEquals("http://b.com/3", frontier.poll().getRequest().getUrl());
        assertNull(frontier.poll());
        assertTrue(frontier.isEmpty());
        assertTrue(frontier.getHosts().isEmpty());
    }

    @Test
    public void testReprioritizeKeepsEntriesAndFifoOrder() {
        Frontier frontier = new Frontier();
        frontier.add(makeEntry("http://a.com/1", "a.com", 0.0, 0));
        frontier.add(makeEntry("http://b.com/2", "b.com", 0.0, 1));
        frontier.add(makeEntry("http://a.com/3", "a.com", 0.0, 2));

        int numChanged = frontier.reprioritize("a.com", new PriorityCalculator() {

            @Override
            public double calculate(CrawlRequest request) {
                return -10.0;
            }
        });

        assertEquals(2, numChanged);
        assertEquals(3, frontier.size());
        assertEquals("http://b.com/2", frontier.poll().getRequest().getUrl());
        assertEquals("http://a.com/1", frontier.poll().getRequest().getUrl());
        assertEquals("http://a.com/3", frontier.poll().getRequest().getUrl());

        assertEquals(0, frontier.reprioritize("unknown.com", null));
    }

    @Test
    public void testFirstReadyPerHost() {
        Frontier frontier = new Frontier();
        frontier.add(makeEntry("http://a.com/held", "a.com", 1.0, 0, 5000));
        frontier.add(makeEntry("http://a.com/low", "a.com", -1.0, 1, 0));
        frontier.add(makeEntry("http://a.com/high", "a.com", 0.0, 2, 0));
        frontier.add(makeEntry("http://b.com/1", "b.com", 0.0, 3, 0));

        assertEquals("http://a.com/high", frontier.firstReady("a.com", 1000).getRequest().getUrl());
        assertEquals("http://a.com/held", frontier.firstReady("a.com", 5000).getRequest().getUrl());
        assertNull(frontier.firstReady("c.com", 1000));

        assertEquals(1000, frontier.getEarliestNotBefore("a.com", 1000));
        assertEquals(Long.MAX_VALUE, frontier.getEarliestNotBefore("c.com", 0));

        // Re-prioritizing keeps the per-host order in step with the global one.
        frontier.reprioritize("a.com", new PriorityCalculator() {

            @Override
            public double calculate(CrawlRequest request) {
                return request.getUrl().endsWith("low") ? 2.0 : -2.0;
            }
        });

        assertEquals("http://a.com/low", frontier.firstReady("a.com", 1000).getRequest().getUrl());
        assertEquals("http://a.com/low", frontier.poll().getRequest().getUrl());
        assertEquals("http://a.com/high", frontier.firstReady("a.com", 1000).getRequest().getUrl());
    }

    @Test
    public void testEarliestNotBefore() {
        Frontier frontier = new Frontier();
        frontier.add(makeEntry("http://a.com/1", "a.com", 0.0, 0, 3000));
        frontier.add(makeEntry("http://a.com/2", "a.com", -1.0, 1, 2000));

        assertEquals(2000, frontier.getEarliestNotBefore("a.com", 0));
        assertEquals(2500, frontier.getEarliestNotBefore("a.com", 2500));
    }

    @Test
    public void testRemove() {
        Frontier frontier = new Frontier();
        FrontierEntry entry = makeEntry("http://a.com/1", "a.com", 0.0, 0);
        frontier.add(entry);

        assertTrue(frontier.remove(entry));
        assertFalse(frontier.remove(entry));
        assertEquals(0, frontier.getHostSize("a.com"));
    }

    @Test(expected = IllegalStateException.class)
    public void testDuplicateSequenceNumber() {
        Frontier frontier = new Frontier();
        frontier.add(makeEntry("http://a.com/1", "a.com", 0.0, 0));
        frontier.add(makeEntry("http://a.com/2", "a.com", 0.0, 0));
    }

    private static FrontierEntry makeEntry(String url, String host, double priority, long sequence) {
        return makeEntry(url, host, priority, sequence, 0);
    }

    private static FrontierEntry makeEntry(String url, String host, double priority, long sequence, long notBefore) {
        return new FrontierEntry(new CrawlRequest(url), host, priority, sequence, notBefore);
    }
}
