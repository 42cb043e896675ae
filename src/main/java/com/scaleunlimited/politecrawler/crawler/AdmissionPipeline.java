package com.scaleunlimited.politecrawler.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.politecrawler.metrics.CrawlerAccumulator;
import com.scaleunlimited.politecrawler.pojos.FetchStatus;
import com.scaleunlimited.politecrawler.robots.RobotsPolicyCache;
import com.scaleunlimited.politecrawler.urls.DomainScopeGuard;
import com.scaleunlimited.politecrawler.urls.UrlPatternFilter;

/**
 * Decides whether a URL may be fetched: robots.txt first, then the
 * include/exclude patterns, then the domain scope. The checks short-circuit,
 * so a URL that robots.txt or the patterns reject never uses up external hop
 * budget.
 */
public class AdmissionPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(AdmissionPipeline.class);

    private final RobotsPolicyCache _robotsCache;
    private final UrlPatternFilter _patternFilter;
    private final DomainScopeGuard _scopeGuard;
    private final CrawlerAccumulator _accumulator;

    public AdmissionPipeline(RobotsPolicyCache robotsCache, UrlPatternFilter patternFilter,
            DomainScopeGuard scopeGuard, CrawlerAccumulator accumulator) {
        _robotsCache = robotsCache;
        _patternFilter = patternFilter;
        _scopeGuard = scopeGuard;
        _accumulator = accumulator;
    }

    public boolean admit(String url) {
        if (!_robotsCache.canFetch(url)) {
            _accumulator.increment(FetchStatus.SKIPPED_BLOCKED);
            return false;
        }

        if (!_patternFilter.isAllowedByPatterns(url)) {
            _accumulator.increment(FetchStatus.SKIPPED_FILTERED);
            return false;
        }

        if (!_scopeGuard.isInScope(url)) {
            LOGGER.debug("Out of scope: {}", url);
            _accumulator.increment(FetchStatus.SKIPPED_OUT_OF_SCOPE);
            return false;
        }

        return true;
    }
}
