package com.scaleunlimited.politecrawler.tools;

import java.util.Arrays;

import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.StringArrayOptionHandler;

import com.scaleunlimited.politecrawler.config.CrawlConfig;
import com.scaleunlimited.politecrawler.output.OutputFormat;

public class CrawlToolOptions {

    public static final String DEFAULT_OUTPUT_FILE = "output.json";

    private String _url;
    private boolean _allowExit = false;
    private int _externalLinksDepth = 0;
    private int _maxDepth = CrawlConfig.DEFAULT_MAX_DEPTH;
    private double _delaySec = CrawlConfig.DEFAULT_CRAWL_DELAY_MS / 1000.0;
    private boolean _noRobots = false;
    private String _botName = CrawlConfig.DEFAULT_ROBOTS_AGENT_NAME;
    private String _outputFile = DEFAULT_OUTPUT_FILE;
    private String _format = OutputFormat.JSON.toString();
    private boolean _verbose = false;
    private String _userAgent = CrawlConfig.DEFAULT_USER_AGENT;
    private int _maxDurationSec = CrawlConfig.NO_DURATION_LIMIT;
    private int _maxQueueSize = CrawlConfig.NO_QUEUE_LIMIT;
    private int _maxOutlinksPerPage = CrawlConfig.DEFAULT_MAX_OUTLINKS_PER_PAGE;
    private int _fetchTimeoutSec = CrawlConfig.DEFAULT_FETCH_TIMEOUT_MS / 1000;
    private int _robotsTimeoutSec = CrawlConfig.DEFAULT_ROBOTS_TIMEOUT_MS / 1000;
    private int _maxContentSize = CrawlConfig.DEFAULT_MAX_CONTENT_SIZE;

    @Option(name = "-exclude", aliases = "--exclude", handler = StringArrayOptionHandler.class,
            usage = "URL patterns to exclude (supports * and ? wildcards)", required = false)
    private String[] _excludePatterns = new String[0];

    @Option(name = "-include", aliases = "--include", handler = StringArrayOptionHandler.class,
            usage = "only include URLs matching these patterns", required = false)
    private String[] _includePatterns = new String[0];

    @Option(name = "-url", aliases = "--url", usage = "starting URL to crawl", required = true)
    public void setUrl(String url) {
        _url = url;
    }

    @Option(name = "-allow-exit", aliases = "--allow-exit", usage = "allow following links to external domains", required = false)
    public void setAllowExit(boolean allowExit) {
        _allowExit = allowExit;
    }

    @Option(name = "-external-links-depth", aliases = "--external-links-depth", usage = "maximum number of external domains to follow (requires -allow-exit)", required = false)
    public void setExternalLinksDepth(int externalLinksDepth) {
        _externalLinksDepth = externalLinksDepth;
    }

    @Option(name = "-depth", aliases = "--depth", usage = "maximum crawl depth (default: 3)", required = false)
    public void setMaxDepth(int maxDepth) {
        _maxDepth = maxDepth;
    }

    @Option(name = "-delay", aliases = "--delay", usage = "minimum delay between requests to a domain, in seconds (default: 1.0)", required = false)
    public void setDelay(double delaySec) {
        _delaySec = delaySec;
    }

    @Option(name = "-no-robots", aliases = "--no-robots", usage = "disable robots.txt compliance (not recommended)", required = false)
    public void setNoRobots(boolean noRobots) {
        _noRobots = noRobots;
    }

    @Option(name = "-bot-name", aliases = "--bot-name", usage = "user-agent name for robots.txt compliance (default: *)", required = false)
    public void setBotName(String botName) {
        _botName = botName;
    }

    @Option(name = "-output", aliases = { "--output", "-o" }, usage = "output file path (default: output.json)", required = false)
    public void setOutputFile(String outputFile) {
        _outputFile = outputFile;
    }

    @Option(name = "-format", aliases = "--format", usage = "output format: json, csv or print (default: json)", required = false)
    public void setFormat(String format) {
        _format = format;
    }

    @Option(name = "-verbose", aliases = { "--verbose", "-v" }, usage = "enable verbose logging", required = false)
    public void setVerbose(boolean verbose) {
        _verbose = verbose;
    }

    @Option(name = "-user-agent", aliases = "--user-agent", usage = "custom User-Agent header", required = false)
    public void setUserAgent(String userAgent) {
        _userAgent = userAgent;
    }

    @Option(name = "-max-duration", aliases = "--max-duration", usage = "stop crawling after this many seconds", required = false)
    public void setMaxDurationSec(int maxDurationSec) {
        _maxDurationSec = maxDurationSec;
    }

    @Option(name = "-max-queue-size", aliases = "--max-queue-size", usage = "maximum number of URLs waiting to be crawled", required = false)
    public void setMaxQueueSize(int maxQueueSize) {
        _maxQueueSize = maxQueueSize;
    }

    @Option(name = "-max-outlinks", aliases = "--max-outlinks", usage = "maximum outlinks per page that are followed", required = false)
    public void setMaxOutlinksPerPage(int maxOutlinksPerPage) {
        _maxOutlinksPerPage = maxOutlinksPerPage;
    }

    @Option(name = "-timeout", aliases = "--timeout", usage = "page fetch timeout, in seconds (default: 15)", required = false)
    public void setFetchTimeoutSec(int fetchTimeoutSec) {
        _fetchTimeoutSec = fetchTimeoutSec;
    }

    @Option(name = "-robots-timeout", aliases = "--robots-timeout", usage = "robots.txt fetch timeout, in seconds (default: 5)", required = false)
    public void setRobotsTimeoutSec(int robotsTimeoutSec) {
        _robotsTimeoutSec = robotsTimeoutSec;
    }

    @Option(name = "-max-content-size", aliases = "--max-content-size", usage = "maximum bytes downloaded per page, longer pages are truncated (default: 10485760)", required = false)
    public void setMaxContentSize(int maxContentSize) {
        _maxContentSize = maxContentSize;
    }

    public void validate() {
        // Fails on an unknown format name.
        getFormat();

        if ((_externalLinksDepth > 0) && !_allowExit) {
            throw new IllegalArgumentException("-external-links-depth requires -allow-exit to be set");
        }

        if (_delaySec < 0) {
            throw new IllegalArgumentException("-delay can't be negative: " + _delaySec);
        }

        if ((_fetchTimeoutSec <= 0) || (_robotsTimeoutSec <= 0)) {
            throw new IllegalArgumentException("Timeouts must be positive");
        }

        if (_maxContentSize <= 0) {
            throw new IllegalArgumentException("-max-content-size must be positive: " + _maxContentSize);
        }
    }

    public CrawlConfig makeCrawlConfig() {
        validate();

        return new CrawlConfig(_url)
                .setAllowExternal(_allowExit)
                .setExternalHopBudget(_externalLinksDepth)
                .setMaxDepth(_maxDepth)
                .setDefaultCrawlDelayMs(Math.round(_delaySec * 1000.0))
                .setExcludePatterns(Arrays.asList(_excludePatterns))
                .setIncludePatterns(Arrays.asList(_includePatterns))
                .setRespectRobots(!_noRobots)
                .setRobotsAgentName(_botName)
                .setUserAgent(_userAgent)
                .setFetchTimeoutMs(_fetchTimeoutSec * 1000)
                .setRobotsTimeoutMs(_robotsTimeoutSec * 1000)
                .setMaxContentSize(_maxContentSize)
                .setMaxOutlinksPerPage(_maxOutlinksPerPage)
                .setMaxQueueSize(_maxQueueSize)
                .setMaxCrawlDurationSec(_maxDurationSec);
    }

    public String getUrl() {
        return _url;
    }

    /**
     * @return file to write results to, or null if they go to the console
     */
    public String getOutputFile() {
        return (getFormat() == OutputFormat.PRINT) ? null : _outputFile;
    }

    public OutputFormat getFormat() {
        return OutputFormat.fromName(_format);
    }

    public boolean isVerbose() {
        return _verbose;
    }

    public boolean isRespectRobots() {
        return !_noRobots;
    }
}
