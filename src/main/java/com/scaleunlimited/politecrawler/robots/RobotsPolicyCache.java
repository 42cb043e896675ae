package com.scaleunlimited.politecrawler.robots;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.politecrawler.fetcher.BaseHttpFetcher;
import com.scaleunlimited.politecrawler.metrics.CrawlerAccumulator;
import com.scaleunlimited.politecrawler.metrics.CrawlerMetrics;
import com.scaleunlimited.politecrawler.pojos.FetchedPage;
import com.scaleunlimited.politecrawler.urls.UrlCanonicalizer;

import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;

/**
 * Fetches, parses and caches the robots.txt rules for each domain we visit.
 * Each domain's robots.txt is fetched at most once per crawl. A missing or
 * unreadable robots.txt means everything is allowed, and that's cached too.
 */
public class RobotsPolicyCache {
    static final Logger LOGGER = LoggerFactory.getLogger(RobotsPolicyCache.class);

    // As per https://developers.google.com/search/reference/robots_txt
    public static final int MAX_ROBOTS_TXT_SIZE = 500 * 1024;

    private final BaseHttpFetcher _fetcher;
    private final SimpleRobotRulesParser _parser;
    private final String _scheme;
    private final String _agentName;
    private final boolean _respectRobots;
    private final CrawlerAccumulator _accumulator;

    private final Map<String, RobotsPolicy> _policies = new ConcurrentHashMap<>();

    /**
     * @param fetcher fetcher to use for robots.txt files
     * @param scheme protocol (from the seed URL) used for every robots.txt request
     * @param agentName token matched against User-agent lines
     * @param respectRobots if false, nothing is ever fetched and every URL is allowed
     * @param accumulator counters for the crawl session
     */
    public RobotsPolicyCache(BaseHttpFetcher fetcher, String scheme, String agentName,
            boolean respectRobots, CrawlerAccumulator accumulator) {
        _fetcher = fetcher;
        _parser = new SimpleRobotRulesParser();

        // A long crawl delay slows down requests to the domain, it doesn't block it.
        _parser.setMaxCrawlDelay(Long.MAX_VALUE);

        _scheme = scheme;
        _agentName = agentName;
        _respectRobots = respectRobots;
        _accumulator = accumulator;
    }

    public RobotsPolicy policyFor(String domain) {
        // The mapping function runs at most once per domain, even with concurrent callers.
        return _policies.computeIfAbsent(domain, d -> loadPolicy(d));
    }

    /**
     * @param url canonical URL
     * @return true if robots.txt compliance is off, or the URL's domain
     * rules allow it
     */
    public boolean canFetch(String url) {
        if (!_respectRobots) {
            return true;
        }

        RobotsPolicy policy = policyFor(UrlCanonicalizer.getDomain(url));
        boolean allowed = policy.isAllowed(url);
        if (!allowed) {
            LOGGER.debug("Blocked by robots.txt: {}", url);
        }

        return allowed;
    }

    /**
     * Never triggers a fetch, so it's safe to call for any domain.
     * 
     * @param domain domain (host plus any non-default port)
     * @return crawl delay in milliseconds, or null if unknown or not set
     */
    public Long getCrawlDelay(String domain) {
        RobotsPolicy policy = _policies.get(domain);
        return (policy == null) ? null : policy.getCrawlDelayMs();
    }

    /**
     * @return map from domain to the crawl delay (ms) its robots.txt declared
     */
    public Map<String, Long> getCrawlDelays() {
        Map<String, Long> result = new TreeMap<>();
        for (Map.Entry<String, RobotsPolicy> entry : _policies.entrySet()) {
            Long crawlDelay = entry.getValue().getCrawlDelayMs();
            if (crawlDelay != null) {
                result.put(entry.getKey(), crawlDelay);
            }
        }

        return result;
    }

    public boolean isRespectRobots() {
        return _respectRobots;
    }

    public int getNumCachedPolicies() {
        return _policies.size();
    }

    private RobotsPolicy loadPolicy(String domain) {
        final String robotsUrl = makeRobotsUrl(domain);

        try {
            FetchedPage result = _fetcher.get(robotsUrl);
            int httpStatusCode = result.getStatusCode();
            LOGGER.trace("Fetched '{}' with status {}", robotsUrl, httpStatusCode);

            if (httpStatusCode != HttpStatus.SC_OK) {
                return failedFetch(domain, httpStatusCode);
            }

            BaseRobotRules rules = _parser.parseContent(robotsUrl, result.getContent(),
                    result.getContentType(), _agentName);
            _accumulator.increment(CrawlerMetrics.COUNTER_ROBOTS_FETCHED);

            RobotsPolicy policy = new RobotsPolicy(rules);
            LOGGER.info("Loaded robots.txt for {}", domain);

            Long crawlDelay = policy.getCrawlDelayMs();
            if (crawlDelay != null) {
                LOGGER.info("Found crawl delay for {}: {}s", domain, crawlDelay / 1000.0);
            }

            return policy;
        } catch (Exception e) {
            LOGGER.debug(String.format("Error fetching robots file for '%s', allowing all", domain), e);
            _accumulator.increment(CrawlerMetrics.COUNTER_ROBOTS_FAILED);
            return RobotsPolicy.ALLOW_ALL;
        }
    }

    private RobotsPolicy failedFetch(String domain, int httpStatusCode) {
        if ((httpStatusCode >= 400) && (httpStatusCode < 500)) {
            _accumulator.increment(CrawlerMetrics.COUNTER_ROBOTS_MISSING);
        } else {
            _accumulator.increment(CrawlerMetrics.COUNTER_ROBOTS_FAILED);
        }

        LOGGER.debug("No usable robots.txt for {} (status {}), allowing all", domain, httpStatusCode);
        return RobotsPolicy.ALLOW_ALL;
    }

    public void close() {
        _fetcher.close();
    }

    private String makeRobotsUrl(String domain) {
        return String.format("%s://%s/robots.txt", _scheme, domain);
    }
}
