package com.scaleunlimited.crawlengine.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import com.scaleunlimited.crawlengine.pojos.ExtractedRecord;

/**
 * Builds a nested record from the first element matching a CSS selector, by
 * running child extractors scoped to that element.
 */
@SuppressWarnings("serial")
public class NestedFieldExtractor extends BaseFieldExtractor {

    private final String _selector;
    private final List<BaseFieldExtractor> _children;

    public NestedFieldExtractor(String fieldName, String selector, List<BaseFieldExtractor> children) {
        super(fieldName);

        _selector = selector;
        _children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    @Override
    public boolean extract(Page page, ExtractedRecord record) throws ExtractionException {
        Elements elements = page.select(_selector);
        if (elements.isEmpty()) {
            return false;
        }

        Element first = elements.first();
        Page scoped = page.scopedTo(first);
        ExtractedRecord nested = new ExtractedRecord(record.getSourceUrl(), record.getFetchTime());
        for (BaseFieldExtractor child : _children) {
            child.extract(scoped, nested);
        }

        if (nested.isEmpty()) {
            return false;
        }

        record.put(getFieldName(), nested);
        return true;
    }

    @Override
    protected List<String> getMatches(Page page) throws ExtractionException {
        throw new UnsupportedOperationException("Nested fields don't have flat matches");
    }
}
