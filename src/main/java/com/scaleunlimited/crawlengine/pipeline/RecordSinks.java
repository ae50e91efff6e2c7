package com.scaleunlimited.crawlengine.pipeline;

import com.scaleunlimited.crawlengine.pojos.ExtractedRecord;

public class RecordSinks {

    private RecordSinks() {
        // Enforce class isn't instantiated
    }

    /**
     * Wrap <sink> so that a failure to accept a record stops the crawl, instead of
     * just being reported.
     */
    public static RecordSink critical(RecordSink sink) {
        if (sink instanceof CriticalRecordSink) {
            return sink;
        }

        return new CriticalRecordSink(sink);
    }

    public static boolean isCritical(RecordSink sink) {
        return sink instanceof CriticalRecordSink;
    }

    private static class CriticalRecordSink implements RecordSink {

        private final RecordSink _delegate;

        public CriticalRecordSink(RecordSink delegate) {
            _delegate = delegate;
        }

        @Override
        public void accept(ExtractedRecord record) throws Exception {
            _delegate.accept(record);
        }

        @Override
        public String toString() {
            return "critical(" + _delegate + ")";
        }
    }
}
