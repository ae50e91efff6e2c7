package com.scaleunlimited.crawlengine.scheduler;

import com.scaleunlimited.crawlengine.pojos.CrawlRequest;

/**
 * A request waiting in the {@link Frontier}. The priority can only be changed
 * by the frontier, since it's part of the entry's sort key.
 */
public class FrontierEntry {

    private final CrawlRequest _request;
    private final String _host;
    private final long _sequence;
    private final long _notBefore;

    private double _priority;

    public FrontierEntry(CrawlRequest request, String host, double priority, long sequence, long notBefore) {
        _request = request;
        _host = host;
        _priority = priority;
        _sequence = sequence;
        _notBefore = notBefore;

        _request.setPriority(priority);
    }

    public CrawlRequest getRequest() {
        return _request;
    }

    public String getHost() {
        return _host;
    }

    public double getPriority() {
        return _priority;
    }

    void setPriority(double priority) {
        _priority = priority;
        _request.setPriority(priority);
    }

    public long getSequence() {
        return _sequence;
    }

    /**
     * @return earliest time this entry may be dispatched (0 for "any time")
     */
    public long getNotBefore() {
        return _notBefore;
    }

    @Override
    public String toString() {
        return String.format("#%d %s (priority=%.2f)", _sequence, _request.getUrl(), _priority);
    }
}
