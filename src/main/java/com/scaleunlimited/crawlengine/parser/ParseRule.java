package com.scaleunlimited.crawlengine.parser;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * One entry in a spider's ordered rule set.
 * 
 * For FOLLOW, the pattern selects which discovered links get crawled (from pages
 * matching the optional source pattern). For PARSE, the pattern selects which
 * fetched pages the extractors run against. BOTH does both.
 */
@SuppressWarnings("serial")
public class ParseRule implements Serializable {

    private final String _name;
    private final UrlPattern _pattern;
    private final UrlPattern _sourcePattern;
    private final RuleCondition _condition;
    private final BaseLinkExtractor _linkExtractor;
    private final List<BaseFieldExtractor> _fieldExtractors;
    private final List<BasePageExtractor> _pageExtractors;

    private ParseRule(Builder builder) {
        _name = builder._name;
        _pattern = builder._pattern;
        _sourcePattern = builder._sourcePattern;
        _condition = builder._condition;
        _linkExtractor = builder._linkExtractor;
        _fieldExtractors = Collections.unmodifiableList(new ArrayList<>(builder._fieldExtractors));
        _pageExtractors = Collections.unmodifiableList(new ArrayList<>(builder._pageExtractors));
    }

    public static Builder builder(UrlPattern pattern, RuleCondition condition) {
        return new Builder(pattern, condition);
    }

    /**
     * Shorthand for a FOLLOW rule with no extractors, which just restricts which
     * links get crawled.
     */
    public static ParseRule follow(String... allowRegexes) {
        return builder(UrlPattern.allow(allowRegexes), RuleCondition.FOLLOW).build();
    }

    public String getName() {
        return _name;
    }

    public UrlPattern getPattern() {
        return _pattern;
    }

    public UrlPattern getSourcePattern() {
        return _sourcePattern;
    }

    public RuleCondition getCondition() {
        return _condition;
    }

    public BaseLinkExtractor getLinkExtractor() {
        return _linkExtractor;
    }

    public List<BaseFieldExtractor> getFieldExtractors() {
        return _fieldExtractors;
    }

    public List<BasePageExtractor> getPageExtractors() {
        return _pageExtractors;
    }

    /**
     * @return true if links on the page at <url> should be considered
     */
    public boolean followsFrom(String url) {
        return _condition.isFollow() && _sourcePattern.matches(url);
    }

    public boolean follows(String linkUrl) {
        return _condition.isFollow() && _pattern.matches(linkUrl);
    }

    public boolean parses(String url) {
        return _condition.isParse() && _pattern.matches(url);
    }

    @Override
    public String toString() {
        return String.format("%s %s (%s)", _name, _condition, _pattern);
    }

    public static class Builder {
        private String _name;
        private UrlPattern _pattern;
        private UrlPattern _sourcePattern = UrlPattern.allowAll();
        private RuleCondition _condition;
        private BaseLinkExtractor _linkExtractor = new CssLinkExtractor();
        private List<BaseFieldExtractor> _fieldExtractors = new ArrayList<>();
        private List<BasePageExtractor> _pageExtractors = new ArrayList<>();

        private Builder(UrlPattern pattern, RuleCondition condition) {
            _pattern = pattern;
            _condition = condition;
        }

        public Builder setName(String name) {
            _name = name;
            return this;
        }

        public Builder setSourcePattern(UrlPattern sourcePattern) {
            _sourcePattern = sourcePattern;
            return this;
        }

        public Builder setLinkExtractor(BaseLinkExtractor linkExtractor) {
            _linkExtractor = linkExtractor;
            return this;
        }

        public Builder addField(BaseFieldExtractor extractor) {
            _fieldExtractors.add(extractor);
            return this;
        }

        public Builder addField(String fieldName, String cssSelector) {
            return addField(new CssFieldExtractor(fieldName, cssSelector));
        }

        public Builder addPageExtractor(BasePageExtractor extractor) {
            _pageExtractors.add(extractor);
            return this;
        }

        /**
         * @throws IllegalArgumentException if the rule is incomplete
         */
        public ParseRule build() {
            if (_pattern == null) {
                throw new IllegalArgumentException("Rule must have a URL pattern");
            }

            if (_condition == null) {
                throw new IllegalArgumentException("Rule must have a condition");
            }

            if (_sourcePattern == null) {
                throw new IllegalArgumentException("Source pattern can't be null");
            }

            if (_condition.isFollow() && (_linkExtractor == null)) {
                throw new IllegalArgumentException("Follow rule must have a link extractor");
            }

            if (_condition.isParse() && _fieldExtractors.isEmpty() && _pageExtractors.isEmpty()) {
                throw new IllegalArgumentException("Parse rule must have at least one extractor");
            }

            if (_name == null) {
                _name = _condition.name().toLowerCase(Locale.ROOT) + "-rule";
            }

            return new ParseRule(this);
        }
    }
}
