package com.scaleunlimited.politecrawler.crawler;

public enum CrawlState {
    IDLE,       // Created, crawl() not yet called
    RUNNING,
    COMPLETED,  // Frontier drained
    ABORTED,    // Seed URL disallowed by robots.txt, nothing was fetched
    CANCELLED;  // Stopped by a terminator before the frontier drained
}
