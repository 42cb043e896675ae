package com.scaleunlimited.politecrawler.fetcher;

import java.util.HashSet;
import java.util.Set;

/**
 * Captures the settings for a fetcher, so that the crawler can create
 * separately configured fetchers for robots.txt files and pages, and tests
 * can swap in fetchers that never touch the network.
 */
public abstract class BaseHttpFetcherBuilder {

    protected int _maxSimultaneousRequests;
    protected CrawlerUserAgent _userAgent;

    protected int _maxContentSize = BaseHttpFetcher.DEFAULT_MAX_CONTENT_SIZE;
    protected Set<String> _validMimeTypes = new HashSet<String>();
    protected int _maxRedirects = BaseHttpFetcher.DEFAULT_MAX_REDIRECTS;
    protected int _timeoutMs = 10 * 1000;

    public BaseHttpFetcherBuilder(int maxSimultaneousRequests, CrawlerUserAgent userAgent) {
        super();

        _maxSimultaneousRequests = maxSimultaneousRequests;
        _userAgent = userAgent;
    }

    public BaseHttpFetcherBuilder setMaxContentSize(int maxContentSize) {
        _maxContentSize = maxContentSize;
        return this;
    }

    public BaseHttpFetcherBuilder setValidMimeTypes(Set<String> validMimeTypes) {
        _validMimeTypes = new HashSet<String>(validMimeTypes);
        return this;
    }

    public BaseHttpFetcherBuilder setMaxRedirects(int maxRedirects) {
        _maxRedirects = maxRedirects;
        return this;
    }

    /**
     * @param timeoutMs max time to wait for a connection, and for data once connected
     * @return this builder
     */
    public BaseHttpFetcherBuilder setTimeoutMs(int timeoutMs) {
        _timeoutMs = timeoutMs;
        return this;
    }

    public int getTimeoutMs() {
        return _timeoutMs;
    }

    public int getMaxContentSize() {
        return _maxContentSize;
    }

    public CrawlerUserAgent getUserAgent() {
        return _userAgent;
    }

    /**
     * @return a new BaseHttpFetcher instance configured to match how this
     * builder was configured
     */
    public abstract BaseHttpFetcher build();

    /**
     * Helper method that {@link #build()} can use to apply the settings
     * shared by all fetchers.
     *
     * @param fetcher instance of BaseHttpFetcher that {@link #build()} has
     * just constructed
     * @return the same fetcher
     */
    protected BaseHttpFetcher configure(BaseHttpFetcher fetcher) {
        fetcher.setMaxContentSize(_maxContentSize);
        fetcher.setValidMimeTypes(_validMimeTypes);
        fetcher.setMaxRedirects(_maxRedirects);
        return fetcher;
    }
}
