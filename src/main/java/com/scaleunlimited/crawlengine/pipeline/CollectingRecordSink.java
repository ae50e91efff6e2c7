package com.scaleunlimited.crawlengine.pipeline;

import java.util.ArrayList;
import java.util.List;

import com.scaleunlimited.crawlengine.pojos.ExtractedRecord;

/**
 * Keeps every record in memory. Handy for small crawls and tests.
 */
public class CollectingRecordSink implements RecordSink {

    private final List<ExtractedRecord> _records = new ArrayList<>();

    @Override
    public synchronized void accept(ExtractedRecord record) throws Exception {
        _records.add(record);
    }

    public synchronized List<ExtractedRecord> getRecords() {
        return new ArrayList<>(_records);
    }

    public synchronized int size() {
        return _records.size();
    }
}
