package com.scaleunlimited.crawlengine.pipeline;

import com.scaleunlimited.crawlengine.pojos.ExtractedRecord;

/**
 * Receives extracted records, one at a time. The crawler never calls a sink
 * concurrently, and all records from a single page arrive together, in
 * extraction order.
 */
public interface RecordSink {

    void accept(ExtractedRecord record) throws Exception;
}
