package com.scaleunlimited.crawlengine.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.crawlengine.pojos.ExtractedRecord;

public class LoggingRecordSink implements RecordSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingRecordSink.class);

    @Override
    public void accept(ExtractedRecord record) throws Exception {
        LOGGER.info("{} => {}", record.getSourceUrl(), record);
    }
}
