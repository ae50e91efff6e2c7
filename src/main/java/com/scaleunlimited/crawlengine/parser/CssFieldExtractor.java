package com.scaleunlimited.crawlengine.parser;

import java.util.List;

@SuppressWarnings("serial")
public class CssFieldExtractor extends BaseFieldExtractor {

    private final String _selector;
    private final String _attribute;

    public CssFieldExtractor(String fieldName, String selector) {
        this(fieldName, selector, null);
    }

    /**
     * @param attribute attribute to take the value from, or null for element text
     */
    public CssFieldExtractor(String fieldName, String selector, String attribute) {
        super(fieldName);

        _selector = selector;
        _attribute = attribute;
    }

    @Override
    protected List<String> getMatches(Page page) throws ExtractionException {
        if (_attribute == null) {
            return page.selectText(_selector);
        } else {
            return page.selectAttribute(_selector, _attribute);
        }
    }
}
