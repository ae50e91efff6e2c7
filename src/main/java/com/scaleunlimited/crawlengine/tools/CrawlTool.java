package com.scaleunlimited.crawlengine.tools;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;

import com.scaleunlimited.crawlengine.config.CrawlSettings;
import com.scaleunlimited.crawlengine.config.CrawlSettingsLoader;
import com.scaleunlimited.crawlengine.config.CrawlTerminator;
import com.scaleunlimited.crawlengine.config.DurationCrawlTerminator;
import com.scaleunlimited.crawlengine.engine.CrawlSummary;
import com.scaleunlimited.crawlengine.engine.Crawler;
import com.scaleunlimited.crawlengine.engine.Spider;
import com.scaleunlimited.crawlengine.parser.CssFieldExtractor;
import com.scaleunlimited.crawlengine.parser.ParseRule;
import com.scaleunlimited.crawlengine.parser.RuleCondition;
import com.scaleunlimited.crawlengine.parser.UrlPattern;
import com.scaleunlimited.crawlengine.pipeline.LoggingRecordSink;

/**
 * Crawls from a list of seed URLs, following links and (optionally) logging
 * each page's title.
 */
public class CrawlTool {

    private static void printUsageAndExit(CmdLineParser parser) {
        parser.printUsage(System.err);
        System.exit(-1);
    }

    public static void main(String[] args) {
        CrawlToolOptions options = new CrawlToolOptions();
        CmdLineParser parser = new CmdLineParser(options);

        try {
            parser.parseArgument(args);
        } catch (CmdLineException e) {
            System.err.println(e.getMessage());
            printUsageAndExit(parser);
        }

        try {
            CrawlSummary summary = run(options);
            System.out.println(summary);
        } catch (Throwable t) {
            System.err.println("Error running CrawlTool: " + t.getMessage());
            t.printStackTrace(System.err);
            System.exit(-1);
        }
    }

    public static CrawlSummary run(CrawlToolOptions options) throws Exception {
        Spider spider = makeSpider(options);

        CrawlSettings settings = spider.getSettings();
        CrawlTerminator terminator = null;
        if (options.getMaxDurationSec() != CrawlToolOptions.NO_DURATION_LIMIT) {
            terminator = new DurationCrawlTerminator(options.getMaxDurationSec());
        }

        Crawler crawler = new Crawler(spider, Crawler.makeFetcher(settings), null, terminator);
        return crawler.run();
    }

    public static Spider makeSpider(CrawlToolOptions options) throws Exception {
        Spider.Builder builder = Spider.builder()
                .setName("crawl-tool")
                .addStartUrls(readSeedUrls(new File(options.getSeedUrlsFilename())))
                .setSettings(makeSettings(options))
                .setSink(new LoggingRecordSink());

        String followPattern = options.getFollowPattern();
        UrlPattern follow = (followPattern == null) ? UrlPattern.allowAll() : UrlPattern.allow(followPattern);
        if (options.getTitleField() != null) {
            builder.addRule(ParseRule.builder(follow, RuleCondition.BOTH)
                    .setName("follow-and-title")
                    .addField(new CssFieldExtractor(options.getTitleField(), "title")));
        } else {
            builder.addRule(ParseRule.builder(follow, RuleCondition.FOLLOW).setName("follow"));
        }

        return builder.build();
    }

    private static CrawlSettings makeSettings(CrawlToolOptions options) throws IOException {
        CrawlSettings.Builder builder;
        if (options.getSettingsFilename() != null) {
            builder = CrawlSettingsLoader.load(new File(options.getSettingsFilename())).toBuilder();
        } else {
            builder = CrawlSettings.builder();
        }

        if (options.getUserAgent() != null) {
            builder.setUserAgent(options.getUserAgent());
        }

        if (options.isSingleDomain()) {
            builder.setAllowedDomains(Collections.singletonList(options.getSingleDomain()));
        }

        if (options.getStrategy() != null) {
            builder.setStrategy(options.getStrategy());
        }

        if (options.getMaxDepth() != CrawlSettings.UNLIMITED_DEPTH) {
            builder.setMaxDepth(options.getMaxDepth());
        }

        if (options.getConcurrentRequests() > 0) {
            builder.setConcurrentRequests(options.getConcurrentRequests());
        }

        if (options.isRobotsCrawlDelay()) {
            builder.setRobotsCrawlDelay(true);
        }

        return builder.build();
    }

    /**
     * @return non-empty lines from <file>, skipping '#' comments
     */
    static List<String> readSeedUrls(File file) throws IOException {
        List<String> result = new ArrayList<>();
        for (String line : FileUtils.readLines(file, StandardCharsets.UTF_8)) {
            line = line.trim();
            if (!line.isEmpty() && !line.startsWith("#")) {
                result.add(line);
            }
        }

        return result;
    }
}
