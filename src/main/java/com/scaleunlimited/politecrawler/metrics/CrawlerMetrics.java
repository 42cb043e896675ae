package com.scaleunlimited.politecrawler.metrics;

public enum CrawlerMetrics {

    COUNTER_PAGES_PARSED("PagesParsed"),
    COUNTER_PAGES_FAILEDPARSE("PagesFailedParse"),
    COUNTER_LINKS_FOUND("LinksFound"),
    COUNTER_LINKS_INVALID("LinksInvalid"),
    COUNTER_LINKS_QUEUED("LinksQueued"),
    COUNTER_ROBOTS_FETCHED("RobotsFetched"),
    COUNTER_ROBOTS_MISSING("RobotsMissing"),
    COUNTER_ROBOTS_FAILED("RobotsFailed"),
    COUNTER_RATE_LIMIT_WAITS("RateLimitWaits");

    private String _name;

    CrawlerMetrics(String name) {
        _name = name;
    }

    @Override
    public String toString() {
        return _name;
    }

}
