package com.scaleunlimited.crawlengine.metrics;

public enum CrawlerMetrics {

    COUNTER_REQUESTS_ADMITTED("RequestsAdmitted"),
    COUNTER_REJECTED_DUPLICATE("RejectedDuplicate"),
    COUNTER_REJECTED_DEPTH("RejectedDepth"),
    COUNTER_REJECTED_FILTERED("RejectedFiltered"),
    COUNTER_RETRIES_SCHEDULED("RetriesScheduled"),

    COUNTER_REQUESTS_DISPATCHED("RequestsDispatched"),
    COUNTER_FETCH_SUCCESS("FetchSuccess"),
    COUNTER_FETCH_REDIRECT("FetchRedirect"),
    COUNTER_FETCH_SOFT_FAILURE("FetchSoftFailure"),
    COUNTER_FETCH_RETRY("FetchRetry"),
    COUNTER_FETCH_TERMINAL_FAILURE("FetchTerminalFailure"),
    COUNTER_FETCH_CANCELLED("FetchCancelled"),

    COUNTER_HOSTS_DEGRADED("HostsDegraded"),

    COUNTER_PAGES_PARSED("PagesParsed"),
    COUNTER_PAGES_NOTPARSED("PagesFailedParse"),
    COUNTER_RECORDS_EXTRACTED("RecordsExtracted"),
    COUNTER_RECORDS_SINK_FAILED("RecordsSinkFailed");

    private String _name;

    CrawlerMetrics(String name) {
        _name = name;
    }

    @Override
    public String toString() {
        return _name;
    }

}
