package com.scaleunlimited.crawlengine.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Links are regex matches against the raw HTML (group 1 if the expression has
 * one), resolved against the page's base URL.
 */
@SuppressWarnings("serial")
public class RegexLinkExtractor extends BaseLinkExtractor {

    private final Pattern _pattern;

    public RegexLinkExtractor(String regex) {
        _pattern = Pattern.compile(regex);
    }

    @Override
    public List<String> extractLinks(Page page) throws ExtractionException {
        List<String> result = new ArrayList<>();
        for (String link : page.matchRegex(_pattern)) {
            String resolved = page.resolve(link);
            if (resolved != null) {
                result.add(resolved);
            }
        }

        return result;
    }

    @Override
    public String toString() {
        return String.format("regex(%s)", _pattern.pattern());
    }
}
