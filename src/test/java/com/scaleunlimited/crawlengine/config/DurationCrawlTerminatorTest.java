package com.scaleunlimited.crawlengine.config;

import static org.junit.Assert.*;

import org.junit.Test;

public class DurationCrawlTerminatorTest {

    @Test
    public void testTerminates() throws Exception {
        DurationCrawlTerminator terminator = new DurationCrawlTerminator(1);
        terminator.open();
        assertFalse(terminator.isTerminated());
        assertTrue(terminator.getRemainingMs() > 0);
        assertTrue(terminator.getRemainingMs() <= 1000);

        Thread.sleep(1100);
        assertTrue(terminator.isTerminated());
        assertTrue(terminator.isTerminated());
        assertEquals(0, terminator.getRemainingMs());
    }

    @Test
    public void testZeroDuration() throws Exception {
        DurationCrawlTerminator terminator = new DurationCrawlTerminator(0);
        terminator.open();
        assertTrue(terminator.isTerminated());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeDuration() throws Exception {
        new DurationCrawlTerminator(-1);
    }
}
