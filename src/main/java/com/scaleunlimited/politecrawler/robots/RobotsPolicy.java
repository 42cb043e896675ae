package com.scaleunlimited.politecrawler.robots;

import crawlercommons.robots.BaseRobotRules;

/**
 * Parsed robots.txt rules for one domain, or the {@link #ALLOW_ALL} policy we
 * use when a domain has no usable robots.txt.
 */
public class RobotsPolicy {

    public static final RobotsPolicy ALLOW_ALL = new RobotsPolicy(null);

    private final BaseRobotRules _rules;

    public RobotsPolicy(BaseRobotRules rules) {
        _rules = rules;
    }

    public boolean isAllowAll() {
        return _rules == null;
    }

    public boolean isAllowed(String url) {
        return (_rules == null) || _rules.isAllowed(url);
    }

    /**
     * @return crawl delay in milliseconds, or null if robots.txt didn't set one
     */
    public Long getCrawlDelayMs() {
        if (_rules == null) {
            return null;
        }

        long crawlDelay = _rules.getCrawlDelay();
        if ((crawlDelay == BaseRobotRules.UNSET_CRAWL_DELAY) || (crawlDelay < 0)) {
            return null;
        }

        return crawlDelay;
    }

    @Override
    public String toString() {
        if (_rules == null) {
            return "allow-all";
        }

        Long crawlDelay = getCrawlDelayMs();
        return (crawlDelay == null) ? "rules" : String.format("rules (crawl delay %dms)", crawlDelay);
    }
}
