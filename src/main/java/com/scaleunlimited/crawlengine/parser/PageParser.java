package com.scaleunlimited.crawlengine.parser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.crawlengine.metrics.CrawlerAccumulator;
import com.scaleunlimited.crawlengine.metrics.CrawlerMetrics;
import com.scaleunlimited.crawlengine.pojos.CrawlRequest;
import com.scaleunlimited.crawlengine.pojos.ExtractedRecord;
import com.scaleunlimited.crawlengine.pojos.FetchedResponse;
import com.scaleunlimited.crawlengine.utils.HttpUtils;
import com.scaleunlimited.crawlengine.utils.UrlLogger;

/**
 * Runs a rule set against a successfully fetched page, returning the child
 * requests to crawl and the records to hand to the sink.
 */
public class PageParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(PageParser.class);

    public static final int UNLIMITED_OUTLINKS = -1;

    private final int _maxOutlinksPerPage;
    private final CrawlerAccumulator _accumulator;

    public PageParser(int maxOutlinksPerPage, CrawlerAccumulator accumulator) {
        _maxOutlinksPerPage = maxOutlinksPerPage;
        _accumulator = accumulator;
    }

    public ParserResult parse(FetchedResponse response, List<ParseRule> rules)
            throws ExtractionException {
        String url = response.getUrl();
        if (!HttpUtils.isHtml(response.getContentType())) {
            LOGGER.debug("Skipping non-HTML content '{}' for {}", response.getContentType(), url);
            _accumulator.increment(CrawlerMetrics.COUNTER_PAGES_NOTPARSED);
            return ParserResult.EMPTY;
        }

        try {
            ParserResult result = parse(Page.parse(response), rules);
            _accumulator.increment(CrawlerMetrics.COUNTER_PAGES_PARSED);
            _accumulator.increment(CrawlerMetrics.COUNTER_RECORDS_EXTRACTED, result.getRecords().size());
            UrlLogger.record(PageParser.class, response.getRequest(),
                    "links", Integer.toString(result.getRequests().size()),
                    "records", Integer.toString(result.getRecords().size()));
            return result;
        } catch (ExtractionException e) {
            _accumulator.increment(CrawlerMetrics.COUNTER_PAGES_NOTPARSED);
            throw e;
        } catch (RuntimeException e) {
            _accumulator.increment(CrawlerMetrics.COUNTER_PAGES_NOTPARSED);
            throw new ExtractionException(url, "Unexpected error while parsing", e);
        }
    }

    private ParserResult parse(Page page, List<ParseRule> rules) throws ExtractionException {
        FetchedResponse response = page.getResponse();
        String url = page.getUrl();
        boolean noFollow = page.isNoFollow();

        Set<String> links = new LinkedHashSet<>();
        ExtractedRecord fieldRecord = new ExtractedRecord(url, response.getFetchTime());
        List<ExtractedRecord> pageRecords = new ArrayList<>();

        for (ParseRule rule : rules) {
            if (!noFollow && rule.followsFrom(url)) {
                for (String link : rule.getLinkExtractor().extractLinks(page)) {
                    if (rule.follows(link)) {
                        links.add(link);
                    }
                }
            }

            if (rule.parses(url)) {
                for (BaseFieldExtractor extractor : rule.getFieldExtractors()) {
                    extractor.extract(page, fieldRecord);
                }

                for (BasePageExtractor extractor : rule.getPageExtractors()) {
                    List<ExtractedRecord> records;
                    try {
                        records = extractor.extract(page);
                    } catch (ExtractionException e) {
                        throw e;
                    } catch (Exception e) {
                        throw new ExtractionException(url, "Page extractor " + extractor + " failed", e);
                    }

                    if (records != null) {
                        pageRecords.addAll(records);
                    }
                }
            }
        }

        if (noFollow) {
            LOGGER.trace("Robots meta tag says nofollow for {}", url);
        }

        List<CrawlRequest> requests = new ArrayList<>();
        CrawlRequest parent = response.getRequest();
        for (String link : links) {
            if ((_maxOutlinksPerPage != UNLIMITED_OUTLINKS) && (requests.size() >= _maxOutlinksPerPage)) {
                LOGGER.debug("Hit limit of {} outlinks for {}", _maxOutlinksPerPage, url);
                break;
            }

            requests.add(parent.makeChild(link));
        }

        List<ExtractedRecord> records = new ArrayList<>();
        if (!fieldRecord.isEmpty()) {
            records.add(fieldRecord);
        }
        records.addAll(pageRecords);

        return new ParserResult(requests, records);
    }
}
