package com.scaleunlimited.politecrawler.crawler;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.scaleunlimited.politecrawler.config.CrawlConfig;
import com.scaleunlimited.politecrawler.fetcher.BaseHttpFetcher;
import com.scaleunlimited.politecrawler.fetcher.DomainRateLimiter;
import com.scaleunlimited.politecrawler.metrics.CrawlerAccumulator;
import com.scaleunlimited.politecrawler.robots.RobotsPolicyCache;
import com.scaleunlimited.politecrawler.urls.DomainScopeGuard;
import com.scaleunlimited.politecrawler.urls.InvalidUrlException;
import com.scaleunlimited.politecrawler.urls.UrlCanonicalizer;
import com.scaleunlimited.politecrawler.urls.UrlPatternFilter;

/**
 * Everything that's shared between the steps of one crawl: robots.txt
 * cache, rate limiter, scope guard, pattern filter, visited set and counters.
 * Nothing here is static, so independent sessions can run side by side.
 */
public class CrawlSession {

    private final CrawlConfig _config;
    private final String _seedUrl;
    private final String _startDomain;

    private final UrlCanonicalizer _canonicalizer;
    private final CrawlerAccumulator _accumulator;
    private final RobotsPolicyCache _robotsCache;
    private final DomainRateLimiter _rateLimiter;
    private final DomainScopeGuard _scopeGuard;
    private final UrlPatternFilter _patternFilter;
    private final AdmissionPipeline _admission;

    private final Set<String> _visited = ConcurrentHashMap.newKeySet();

    public CrawlSession(CrawlConfig config, BaseHttpFetcher robotsFetcher) throws InvalidUrlException {
        this(config, robotsFetcher, null);
    }

    /**
     * @param config crawl settings
     * @param robotsFetcher fetcher used for robots.txt files
     * @param rateLimiter limiter to use, or null to create one with the
     * configured default delay
     * @throws InvalidUrlException if the seed URL isn't a valid http(s) URL
     */
    public CrawlSession(CrawlConfig config, BaseHttpFetcher robotsFetcher, DomainRateLimiter rateLimiter)
            throws InvalidUrlException {
        config.validate();

        _config = config;
        _canonicalizer = new UrlCanonicalizer();
        _seedUrl = _canonicalizer.canonicalize(config.getSeedUrl());
        _startDomain = UrlCanonicalizer.getDomain(_seedUrl);

        _accumulator = new CrawlerAccumulator();
        _robotsCache = new RobotsPolicyCache(robotsFetcher, UrlCanonicalizer.getScheme(_seedUrl),
                config.getRobotsAgentName(), config.isRespectRobots(), _accumulator);
        if (rateLimiter == null) {
            rateLimiter = new DomainRateLimiter(config.getDefaultCrawlDelayMs());
        }

        _rateLimiter = rateLimiter.setRobotsCache(_robotsCache);
        _scopeGuard = new DomainScopeGuard(_startDomain, config.isAllowExternal(),
                config.getExternalHopBudget());
        _patternFilter = new UrlPatternFilter(config.getExcludePatterns(), config.getIncludePatterns());
        _admission = new AdmissionPipeline(_robotsCache, _patternFilter, _scopeGuard, _accumulator);
    }

    /**
     * Atomically check and mark a URL as visited.
     * 
     * @param url canonical URL
     * @return true if the URL had not been visited before
     */
    public boolean markVisited(String url) {
        return _visited.add(url);
    }

    public boolean isVisited(String url) {
        return _visited.contains(url);
    }

    public int getVisitedCount() {
        return _visited.size();
    }

    public Set<String> getVisitedUrls() {
        return _visited;
    }

    public CrawlConfig getConfig() {
        return _config;
    }

    public String getSeedUrl() {
        return _seedUrl;
    }

    public String getStartDomain() {
        return _startDomain;
    }

    public UrlCanonicalizer getCanonicalizer() {
        return _canonicalizer;
    }

    public CrawlerAccumulator getCounters() {
        return _accumulator;
    }

    public RobotsPolicyCache getRobotsCache() {
        return _robotsCache;
    }

    public DomainRateLimiter getRateLimiter() {
        return _rateLimiter;
    }

    public DomainScopeGuard getScopeGuard() {
        return _scopeGuard;
    }

    public UrlPatternFilter getPatternFilter() {
        return _patternFilter;
    }

    public AdmissionPipeline getAdmission() {
        return _admission;
    }
}
