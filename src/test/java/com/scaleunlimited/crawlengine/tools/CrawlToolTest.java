package com.scaleunlimited.crawlengine.tools;

import static org.junit.Assert.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;

import com.scaleunlimited.crawlengine.config.CrawlStrategy;
import com.scaleunlimited.crawlengine.engine.Spider;
import com.scaleunlimited.crawlengine.parser.RuleCondition;

public class CrawlToolTest {

    @Rule
    public TemporaryFolder _tempDir = new TemporaryFolder();

    @Test
    public void testReadSeedUrls() throws Exception {
        File seeds = writeSeeds("# seeds\n", "http://example.com/\n", "\n", "  http://example.org/  \n");

        List<String> urls = CrawlTool.readSeedUrls(seeds);
        assertEquals(Arrays.asList("http://example.com/", "http://example.org/"), urls);
    }

    @Test
    public void testMakeSpider() throws Exception {
        File seeds = writeSeeds("http://example.com/\n");
        File settingsFile = _tempDir.newFile("crawl.properties");
        FileUtils.writeStringToFile(settingsFile, "downloader.retry_cap = 1\nscheduler.max_depth = 5\n",
                StandardCharsets.UTF_8);

        CrawlToolOptions options = parse("-seedurls", seeds.getAbsolutePath(),
                "-settings", settingsFile.getAbsolutePath(),
                "-agent", "testbot, bot@example.com, http://example.com/bot",
                "-singledomain", "example.com",
                "-strategy", "DFO",
                "-maxdepth", "2",
                "-concurrency", "4",
                "-title", "title");

        Spider spider = CrawlTool.makeSpider(options);
        assertEquals(1, spider.getStartRequests().size());
        assertEquals(1, spider.getSettings().getRetryCap());
        assertEquals(2, spider.getSettings().getMaxDepth());
        assertEquals(CrawlStrategy.DFO, spider.getSettings().getStrategy());
        assertEquals(4, spider.getSettings().getConcurrentRequests());
        assertEquals(Arrays.asList("example.com"), spider.getSettings().getAllowedDomains());
        assertEquals("testbot (+http://example.com/bot; bot@example.com)",
                spider.getSettings().getUserAgents().get(0));

        assertEquals(1, spider.getRules().size());
        assertEquals(RuleCondition.BOTH, spider.getRules().get(0).getCondition());
    }

    @Test
    public void testFollowOnly() throws Exception {
        File seeds = writeSeeds("http://example.com/\n");
        CrawlToolOptions options = parse("-seedurls", seeds.getAbsolutePath(), "-follow", "/docs/");

        Spider spider = CrawlTool.makeSpider(options);
        assertEquals(RuleCondition.FOLLOW, spider.getRules().get(0).getCondition());
        assertEquals(CrawlToolOptions.NO_DURATION_LIMIT, options.getMaxDurationSec());
    }

    @Test(expected = CmdLineException.class)
    public void testSeedsRequired() throws Exception {
        parse("-maxdepth", "2");
    }

    @Test
    public void testInvalidUserAgent() throws Exception {
        CrawlToolOptions options = new CrawlToolOptions();
        try {
            options.setUserAgent("testbot,not-an-email,http://example.com");
            fail("Should have thrown exception");
        } catch (RuntimeException e) {
            assertTrue(e.getMessage().contains("email"));
        }
    }

    private File writeSeeds(String... lines) throws Exception {
        File result = _tempDir.newFile("seeds.txt");
        FileUtils.writeStringToFile(result, String.join("", lines), StandardCharsets.UTF_8);
        return result;
    }

    private static CrawlToolOptions parse(String... args) throws CmdLineException {
        CrawlToolOptions options = new CrawlToolOptions();
        new CmdLineParser(options).parseArgument(args);
        return options;
    }
}
