package com.scaleunlimited.crawlengine.parser;

import java.util.Collections;
import java.util.List;

import com.scaleunlimited.crawlengine.pojos.CrawlRequest;
import com.scaleunlimited.crawlengine.pojos.ExtractedRecord;

public class ParserResult {

    public static final ParserResult EMPTY = new ParserResult(
            Collections.<CrawlRequest> emptyList(), Collections.<ExtractedRecord> emptyList());

    private final List<CrawlRequest> _requests;
    private final List<ExtractedRecord> _records;

    public ParserResult(List<CrawlRequest> requests, List<ExtractedRecord> records) {
        _requests = Collections.unmodifiableList(requests);
        _records = Collections.unmodifiableList(records);
    }

    public List<CrawlRequest> getRequests() {
        return _requests;
    }

    public List<ExtractedRecord> getRecords() {
        return _records;
    }

    public boolean isEmpty() {
        return _requests.isEmpty() && _records.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("%d requests, %d records", _requests.size(), _records.size());
    }
}
