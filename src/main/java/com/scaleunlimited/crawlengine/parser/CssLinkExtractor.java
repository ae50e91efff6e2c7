package com.scaleunlimited.crawlengine.parser;

import java.util.List;

/**
 * Links are the values of an attribute (href by default) on elements matching a
 * CSS selector.
 */
@SuppressWarnings("serial")
public class CssLinkExtractor extends BaseLinkExtractor {

    public static final String DEFAULT_SELECTOR = "a[href]";
    public static final String DEFAULT_ATTRIBUTE = "href";

    private final String _selector;
    private final String _attribute;

    public CssLinkExtractor() {
        this(DEFAULT_SELECTOR, DEFAULT_ATTRIBUTE);
    }

    public CssLinkExtractor(String selector) {
        this(selector, selector.contains("[src]") ? "src" : DEFAULT_ATTRIBUTE);
    }

    public CssLinkExtractor(String selector, String attribute) {
        _selector = selector;
        _attribute = attribute;
    }

    @Override
    public List<String> extractLinks(Page page) throws ExtractionException {
        return page.selectAttribute(_selector, _attribute);
    }

    @Override
    public String toString() {
        return String.format("css(%s@%s)", _selector, _attribute);
    }
}
