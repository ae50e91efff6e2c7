package com.scaleunlimited.crawlengine.parser;

import java.io.Serializable;
import java.util.List;

@SuppressWarnings("serial")
public abstract class BaseLinkExtractor implements Serializable {

    /**
     * @return absolute URLs of candidate links, in document order. May contain
     *         duplicates.
     */
    public abstract List<String> extractLinks(Page page) throws ExtractionException;
}
