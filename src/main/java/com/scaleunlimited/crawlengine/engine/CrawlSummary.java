package com.scaleunlimited.crawlengine.engine;

import java.util.Collections;
import java.util.Map;

import com.scaleunlimited.crawlengine.metrics.CounterUtils;

public class CrawlSummary {

    private final CrawlState _finalState;
    private final CrawlState _stoppedFrom;
    private final long _startTime;
    private final long _endTime;
    private final Map<String, Long> _counters;

    public CrawlSummary(CrawlState finalState, CrawlState stoppedFrom, long startTime, long endTime,
            Map<String, Long> counters) {
        _finalState = finalState;
        _stoppedFrom = stoppedFrom;
        _startTime = startTime;
        _endTime = endTime;
        _counters = Collections.unmodifiableMap(counters);
    }

    public CrawlState getFinalState() {
        return _finalState;
    }

    /**
     * @return RUNNING if the crawl ran until the frontier was exhausted,
     *         otherwise DRAINING or CANCELLING
     */
    public CrawlState getStoppedFrom() {
        return _stoppedFrom;
    }

    public long getStartTime() {
        return _startTime;
    }

    public long getEndTime() {
        return _endTime;
    }

    public long getDurationMs() {
        return _endTime - _startTime;
    }

    public Map<String, Long> getCounters() {
        return _counters;
    }

    public long getCounter(Enum<?> e) {
        Long result = _counters.get(CounterUtils.enumToKey(e));
        return (result == null) ? 0L : result;
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        result.append(String.format("Crawl %s (from %s) after %dms", _finalState, _stoppedFrom,
                getDurationMs()));
        for (Map.Entry<String, Long> entry : _counters.entrySet()) {
            result.append(String.format("\n\t%s: %d", CounterUtils.groupCounterToCounter(entry.getKey()),
                    entry.getValue()));
        }

        return result.toString();
    }
}
