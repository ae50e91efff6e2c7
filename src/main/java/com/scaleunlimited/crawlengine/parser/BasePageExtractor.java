package com.scaleunlimited.crawlengine.parser;

import java.io.Serializable;
import java.util.List;

import com.scaleunlimited.crawlengine.pojos.ExtractedRecord;

/**
 * Page-level extraction, for when a single field at a time isn't enough. Returns
 * zero or more complete records.
 */
@SuppressWarnings("serial")
public abstract class BasePageExtractor implements Serializable {

    public abstract List<ExtractedRecord> extract(Page page) throws Exception;

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
