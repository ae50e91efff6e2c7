package com.scaleunlimited.crawlengine.tools;

import org.kohsuke.args4j.Option;

import com.scaleunlimited.crawlengine.config.CrawlSettings;
import com.scaleunlimited.crawlengine.config.CrawlStrategy;

public class CrawlToolOptions {

    public static final int NO_DURATION_LIMIT = -1;

    private String _userAgent = null;
    private String _seedUrlsFilename;
    private String _settingsFilename = null;
    private String _singleDomain = null;
    private String _followPattern = null;
    private String _titleField = null;
    private CrawlStrategy _strategy = null;
    private int _maxDepth = CrawlSettings.UNLIMITED_DEPTH;
    private int _concurrentRequests = 0;
    private int _maxDurationSec = NO_DURATION_LIMIT;
    private boolean _robotsCrawlDelay = false;

    @Option(name = "-agent", usage = "user agent info, format:'name,email,website'", required = false)
    public void setUserAgent(String agentNameEmailWebsite) {
        String fields[] = agentNameEmailWebsite.split(",", 4);
        if (fields.length != 3) {
            throw new RuntimeException(
                    "Invalid format for user agent (expected 'name,email,website'): "
                            + agentNameEmailWebsite);
        }

        String agentName = fields[0].trim();
        String agentEmail = fields[1].trim();
        String agentWebSite = fields[2].trim();
        if (!(agentEmail.contains("@"))) {
            throw new RuntimeException("Invalid email address for user agent: " + agentEmail);
        }

        if (!(agentWebSite.startsWith("http"))) {
            throw new RuntimeException("Invalid web site URL for user agent: " + agentWebSite);
        }

        _userAgent = String.format("%s (+%s; %s)", agentName, agentWebSite, agentEmail);
    }

    @Option(name = "-seedurls", usage = "text file containing list of seed urls", required = true)
    public void setSeedUrlsFilename(String seedUrlsFilename) {
        _seedUrlsFilename = seedUrlsFilename;
    }

    @Option(name = "-settings", usage = "properties file with crawl settings", required = false)
    public void setSettingsFilename(String settingsFilename) {
        _settingsFilename = settingsFilename;
    }

    @Option(name = "-singledomain", usage = "only fetch URLs within this domain (and its sub-domains)", required = false)
    public void setSingleDomain(String singleDomain) {
        _singleDomain = singleDomain;
    }

    @Option(name = "-follow", usage = "regex for links to follow (default is all links)", required = false)
    public void setFollowPattern(String followPattern) {
        _followPattern = followPattern;
    }

    @Option(name = "-title", usage = "extract the page title into this field", required = false)
    public void setTitleField(String titleField) {
        _titleField = titleField;
    }

    @Option(name = "-strategy", usage = "crawl strategy (BFO, DFO, BASIC, FEEDBACK)", required = false)
    public void setStrategy(CrawlStrategy strategy) {
        _strategy = strategy;
    }

    @Option(name = "-maxdepth", usage = "maximum link depth from the seeds", required = false)
    public void setMaxDepth(int maxDepth) {
        _maxDepth = maxDepth;
    }

    @Option(name = "-concurrency", usage = "maximum number of concurrent fetches", required = false)
    public void setConcurrentRequests(int concurrentRequests) {
        _concurrentRequests = concurrentRequests;
    }

    @Option(name = "-durationsec", usage = "stop the crawl after this many seconds", required = false)
    public void setMaxDurationSec(int maxDurationSec) {
        _maxDurationSec = maxDurationSec;
    }

    @Option(name = "-robotsdelay", usage = "use robots.txt crawl delay as the minimum delay per host", required = false)
    public void setRobotsCrawlDelay(boolean robotsCrawlDelay) {
        _robotsCrawlDelay = robotsCrawlDelay;
    }

    public String getUserAgent() {
        return _userAgent;
    }

    public String getSeedUrlsFilename() {
        return _seedUrlsFilename;
    }

    public String getSettingsFilename() {
        return _settingsFilename;
    }

    public boolean isSingleDomain() {
        return _singleDomain != null;
    }

    public String getSingleDomain() {
        return _singleDomain;
    }

    public String getFollowPattern() {
        return _followPattern;
    }

    public String getTitleField() {
        return _titleField;
    }

    public CrawlStrategy getStrategy() {
        return _strategy;
    }

    public int getMaxDepth() {
        return _maxDepth;
    }

    public int getConcurrentRequests() {
        return _concurrentRequests;
    }

    public int getMaxDurationSec() {
        return _maxDurationSec;
    }

    public boolean isRobotsCrawlDelay() {
        return _robotsCrawlDelay;
    }
}
