package com.scaleunlimited.crawlengine.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe named counters for one crawl, keyed by enum. Any enum works;
 * the counter name is "<enum class>-><enum name>".
 */
public class CrawlerAccumulator {

    private final ConcurrentMap<String, AtomicLong> _counters;

    public CrawlerAccumulator() {
        _counters = new ConcurrentHashMap<>();
    }

    /**
     * Increment the counter for the enum e by 1
     * 
     * @param e
     *            The enum to use as a name
     */
    public void increment(Enum<?> e) {
        increment(e, 1);
    }

    /**
     * Modify the counter for the enum e by changeBy - if positive the counter is incremented; if negative it is
     * decremented.
     * 
     * @param e
     *            The enum to use as a name
     * @param changeBy
     *            the value to modify the counter by
     */
    public void increment(Enum<?> e, long changeBy) {
        getCounter(CounterUtils.enumToKey(e)).addAndGet(changeBy);
    }

    public long getValue(Enum<?> e) {
        AtomicLong counter = _counters.get(CounterUtils.enumToKey(e));
        return (counter == null) ? 0L : counter.get();
    }

    /**
     * @return copy of all non-zero counters, sorted by name
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> result = new TreeMap<>();
        for (Map.Entry<String, AtomicLong> entry : _counters.entrySet()) {
            long value = entry.getValue().get();
            if (value != 0) {
                result.put(entry.getKey(), value);
            }
        }

        return result;
    }

    private AtomicLong getCounter(String key) {
        AtomicLong result = _counters.get(key);
        if (result == null) {
            AtomicLong newCounter = new AtomicLong();
            result = _counters.putIfAbsent(key, newCounter);
            if (result == null) {
                result = newCounter;
            }
        }

        return result;
    }
}
