package com.scaleunlimited.politecrawler.config;

/**
 * Polled by the crawler before it takes the next entry off the frontier.
 * Any terminator can also be cancelled from another thread (e.g. a shutdown
 * hook), which stops the crawl at its next safe point.
 */
public abstract class CrawlTerminator {

    private volatile boolean _cancelled = false;

    public void open() {

    }

    public void cancel() {
        _cancelled = true;
    }

    public boolean isCancelled() {
        return _cancelled;
    }

    public abstract boolean isTerminated();
}
