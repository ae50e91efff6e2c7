package com.scaleunlimited.crawlengine.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.scaleunlimited.crawlengine.config.CrawlSettings;
import com.scaleunlimited.crawlengine.downloader.BaseDownloaderMiddleware;
import com.scaleunlimited.crawlengine.parser.ParseRule;
import com.scaleunlimited.crawlengine.pipeline.LoggingRecordSink;
import com.scaleunlimited.crawlengine.pipeline.RecordSink;
import com.scaleunlimited.crawlengine.pojos.CrawlRequest;
import com.scaleunlimited.crawlengine.urls.BaseUrlValidator;
import com.scaleunlimited.crawlengine.urls.SimpleUrlValidator;

/**
 * Everything a crawl needs to know about what to fetch and what to do with it:
 * start requests, ordered rules, settings, extra downloader middleware and the
 * record sink. Immutable once built.
 */
public class Spider {

    private final String _name;
    private final List<CrawlRequest> _startRequests;
    private final List<ParseRule> _rules;
    private final CrawlSettings _settings;
    private final List<BaseDownloaderMiddleware> _middleware;
    private final RecordSink _sink;

    private Spider(Builder builder, List<ParseRule> rules) {
        _name = builder._name;
        _startRequests = Collections.unmodifiableList(new ArrayList<>(builder._startRequests));
        _rules = Collections.unmodifiableList(rules);
        _settings = builder._settings;
        _middleware = Collections.unmodifiableList(new ArrayList<>(builder._middleware));
        _sink = builder._sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return _name;
    }

    public List<CrawlRequest> getStartRequests() {
        return _startRequests;
    }

    public List<ParseRule> getRules() {
        return _rules;
    }

    public CrawlSettings getSettings() {
        return _settings;
    }

    public List<BaseDownloaderMiddleware> getMiddleware() {
        return _middleware;
    }

    public RecordSink getSink() {
        return _sink;
    }

    @Override
    public String toString() {
        return String.format("%s (%d start requests, %d rules)", _name, _startRequests.size(),
                _rules.size());
    }

    public static class Builder {
        private String _name = "spider";
        private List<CrawlRequest> _startRequests = new ArrayList<>();
        private List<ParseRule> _rules = new ArrayList<>();
        private SpiderConfigException _ruleError = null;
        private CrawlSettings _settings = CrawlSettings.builder().build();
        private List<BaseDownloaderMiddleware> _middleware = new ArrayList<>();
        private RecordSink _sink = new LoggingRecordSink();

        private Builder() {
        }

        public Builder setName(String name) {
            _name = name;
            return this;
        }

        public Builder addStartUrl(String url) {
            _startRequests.add(new CrawlRequest(url));
            return this;
        }

        public Builder addStartUrls(Collection<String> urls) {
            for (String url : urls) {
                addStartUrl(url);
            }

            return this;
        }

        public Builder addStartRequest(CrawlRequest request) {
            _startRequests.add(request);
            return this;
        }

        public Builder addRule(ParseRule rule) {
            _rules.add(rule);
            return this;
        }

        /**
         * The rule is built right away, but if it's invalid the error is only
         * thrown when the spider is built.
         */
        public Builder addRule(ParseRule.Builder ruleBuilder) {
            if (ruleBuilder == null) {
                _rules.add(null);
                return this;
            }

            try {
                _rules.add(ruleBuilder.build());
            } catch (IllegalArgumentException e) {
                if (_ruleError == null) {
                    _ruleError = new SpiderConfigException("Invalid rule: " + e.getMessage(), e);
                }
            }

            return this;
        }

        public Builder setSettings(CrawlSettings settings) {
            _settings = settings;
            return this;
        }

        /**
         * Add middleware that runs after the built-in chain.
         */
        public Builder addMiddleware(BaseDownloaderMiddleware middleware) {
            _middleware.add(middleware);
            return this;
        }

        public Builder setSink(RecordSink sink) {
            _sink = sink;
            return this;
        }

        public Spider build() throws SpiderConfigException {
            if (_settings == null) {
                throw new SpiderConfigException("Settings must be provided");
            }

            if (_sink == null) {
                throw new SpiderConfigException("A record sink must be provided");
            }

            if (_startRequests.isEmpty()) {
                throw new SpiderConfigException("At least one start URL is required");
            }

            BaseUrlValidator validator = new SimpleUrlValidator();
            for (CrawlRequest request : _startRequests) {
                if ((request == null) || !validator.isValid(request.getUrl())) {
                    throw new SpiderConfigException("Invalid start URL: "
                            + ((request == null) ? null : request.getUrl()));
                }
            }

            if (_ruleError != null) {
                throw _ruleError;
            }

            for (ParseRule rule : _rules) {
                if (rule == null) {
                    throw new SpiderConfigException("Rule can't be null");
                }
            }

            for (BaseDownloaderMiddleware middleware : _middleware) {
                if (middleware == null) {
                    throw new SpiderConfigException("Middleware can't be null");
                }
            }

            return new Spider(this, new ArrayList<>(_rules));
        }
    }
}
