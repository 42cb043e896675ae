package com.scaleunlimited.politecrawler.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings for one crawl session. Defaults match the command line tool.
 */
public class CrawlConfig {

    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (compatible; PoliteCrawler/1.0)";
    public static final String DEFAULT_ROBOTS_AGENT_NAME = "*";

    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final long DEFAULT_CRAWL_DELAY_MS = 1000L;
    public static final int DEFAULT_FETCH_TIMEOUT_MS = 15 * 1000;
    public static final int DEFAULT_ROBOTS_TIMEOUT_MS = 5 * 1000;
    public static final int DEFAULT_PROBE_TIMEOUT_MS = 10 * 1000;
    public static final int DEFAULT_MAX_OUTLINKS_PER_PAGE = 1000;
    public static final int DEFAULT_MAX_CONTENT_SIZE = 10 * 1024 * 1024;

    // Extra wait after a 429 response, as a multiple of the default delay.
    public static final int RATE_LIMITED_BACKOFF_FACTOR = 3;

    public static final int NO_QUEUE_LIMIT = Integer.MAX_VALUE;
    public static final int NO_DURATION_LIMIT = -1;

    private String _seedUrl;
    private boolean _allowExternal = false;
    private int _externalHopBudget = 0;
    private int _maxDepth = DEFAULT_MAX_DEPTH;
    private long _defaultCrawlDelayMs = DEFAULT_CRAWL_DELAY_MS;
    private List<String> _excludePatterns = new ArrayList<>();
    private List<String> _includePatterns = new ArrayList<>();
    private boolean _respectRobots = true;
    private String _robotsAgentName = DEFAULT_ROBOTS_AGENT_NAME;
    private String _userAgent = DEFAULT_USER_AGENT;
    private int _fetchTimeoutMs = DEFAULT_FETCH_TIMEOUT_MS;
    private int _robotsTimeoutMs = DEFAULT_ROBOTS_TIMEOUT_MS;
    private int _probeTimeoutMs = DEFAULT_PROBE_TIMEOUT_MS;
    private int _maxContentSize = DEFAULT_MAX_CONTENT_SIZE;
    private int _maxOutlinksPerPage = DEFAULT_MAX_OUTLINKS_PER_PAGE;
    private int _maxQueueSize = NO_QUEUE_LIMIT;
    private int _maxCrawlDurationSec = NO_DURATION_LIMIT;

    public CrawlConfig() {
    }

    public CrawlConfig(String seedUrl) {
        _seedUrl = seedUrl;
    }

    /**
     * Check for settings that can't work together.
     * 
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public void validate() {
        if ((_seedUrl == null) || _seedUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("A seed URL is required");
        }

        if (_externalHopBudget < 0) {
            throw new IllegalArgumentException("External links depth can't be negative");
        }

        if ((_externalHopBudget > 0) && !_allowExternal) {
            throw new IllegalArgumentException("External links depth requires external links to be allowed");
        }

        if (_maxDepth < 0) {
            throw new IllegalArgumentException("Max depth can't be negative");
        }

        if (_defaultCrawlDelayMs < 0) {
            throw new IllegalArgumentException("Crawl delay can't be negative");
        }

        if (_maxContentSize < 1) {
            throw new IllegalArgumentException("Max content size must be at least 1 byte");
        }

        if (_maxQueueSize < 1) {
            throw new IllegalArgumentException("Max queue size must be at least 1");
        }
    }

    public String getSeedUrl() {
        return _seedUrl;
    }

    public CrawlConfig setSeedUrl(String seedUrl) {
        _seedUrl = seedUrl;
        return this;
    }

    public boolean isAllowExternal() {
        return _allowExternal;
    }

    public CrawlConfig setAllowExternal(boolean allowExternal) {
        _allowExternal = allowExternal;
        return this;
    }

    public int getExternalHopBudget() {
        return _externalHopBudget;
    }

    public CrawlConfig setExternalHopBudget(int externalHopBudget) {
        _externalHopBudget = externalHopBudget;
        return this;
    }

    public int getMaxDepth() {
        return _maxDepth;
    }

    public CrawlConfig setMaxDepth(int maxDepth) {
        _maxDepth = maxDepth;
        return this;
    }

    public long getDefaultCrawlDelayMs() {
        return _defaultCrawlDelayMs;
    }

    public CrawlConfig setDefaultCrawlDelayMs(long defaultCrawlDelayMs) {
        _defaultCrawlDelayMs = defaultCrawlDelayMs;
        return this;
    }

    public long getRateLimitedBackoffMs() {
        return RATE_LIMITED_BACKOFF_FACTOR * _defaultCrawlDelayMs;
    }

    public List<String> getExcludePatterns() {
        return Collections.unmodifiableList(_excludePatterns);
    }

    public CrawlConfig setExcludePatterns(List<String> excludePatterns) {
        _excludePatterns = new ArrayList<>(excludePatterns);
        return this;
    }

    public List<String> getIncludePatterns() {
        return Collections.unmodifiableList(_includePatterns);
    }

    public CrawlConfig setIncludePatterns(List<String> includePatterns) {
        _includePatterns = new ArrayList<>(includePatterns);
        return this;
    }

    public boolean isRespectRobots() {
        return _respectRobots;
    }

    public CrawlConfig setRespectRobots(boolean respectRobots) {
        _respectRobots = respectRobots;
        return this;
    }

    public String getRobotsAgentName() {
        return _robotsAgentName;
    }

    public CrawlConfig setRobotsAgentName(String robotsAgentName) {
        _robotsAgentName = robotsAgentName;
        return this;
    }

    public String getUserAgent() {
        return _userAgent;
    }

    public CrawlConfig setUserAgent(String userAgent) {
        _userAgent = userAgent;
        return this;
    }

    public int getFetchTimeoutMs() {
        return _fetchTimeoutMs;
    }

    public CrawlConfig setFetchTimeoutMs(int fetchTimeoutMs) {
        _fetchTimeoutMs = fetchTimeoutMs;
        return this;
    }

    public int getRobotsTimeoutMs() {
        return _robotsTimeoutMs;
    }

    public CrawlConfig setRobotsTimeoutMs(int robotsTimeoutMs) {
        _robotsTimeoutMs = robotsTimeoutMs;
        return this;
    }

    public int getProbeTimeoutMs() {
        return _probeTimeoutMs;
    }

    public CrawlConfig setProbeTimeoutMs(int probeTimeoutMs) {
        _probeTimeoutMs = probeTimeoutMs;
        return this;
    }

    /**
     * @return max bytes of a page we download; anything after that is dropped
     */
    public int getMaxContentSize() {
        return _maxContentSize;
    }

    public CrawlConfig setMaxContentSize(int maxContentSize) {
        _maxContentSize = maxContentSize;
        return this;
    }

    public int getMaxOutlinksPerPage() {
        return _maxOutlinksPerPage;
    }

    public CrawlConfig setMaxOutlinksPerPage(int maxOutlinksPerPage) {
        _maxOutlinksPerPage = maxOutlinksPerPage;
        return this;
    }

    public int getMaxQueueSize() {
        return _maxQueueSize;
    }

    public CrawlConfig setMaxQueueSize(int maxQueueSize) {
        _maxQueueSize = maxQueueSize;
        return this;
    }

    public int getMaxCrawlDurationSec() {
        return _maxCrawlDurationSec;
    }

    public CrawlConfig setMaxCrawlDurationSec(int maxCrawlDurationSec) {
        _maxCrawlDurationSec = maxCrawlDurationSec;
        return this;
    }

    public CrawlTerminator makeTerminator() {
        if (_maxCrawlDurationSec == NO_DURATION_LIMIT) {
            return new ManualCrawlTerminator();
        } else {
            return new DurationCrawlTerminator(_maxCrawlDurationSec);
        }
    }
}
