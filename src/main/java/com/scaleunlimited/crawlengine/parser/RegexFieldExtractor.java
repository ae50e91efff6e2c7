package com.scaleunlimited.crawlengine.parser;

import java.util.List;
import java.util.regex.Pattern;

@SuppressWarnings("serial")
public class RegexFieldExtractor extends BaseFieldExtractor {

    private final Pattern _pattern;

    public RegexFieldExtractor(String fieldName, String regex) {
        super(fieldName);

        _pattern = Pattern.compile(regex);
    }

    @Override
    protected List<String> getMatches(Page page) throws ExtractionException {
        return page.matchRegex(_pattern);
    }
}
