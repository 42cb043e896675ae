package com.scaleunlimited.politecrawler.fetcher;

public class SimpleHttpFetcherBuilder extends BaseHttpFetcherBuilder {

    public SimpleHttpFetcherBuilder(CrawlerUserAgent userAgent) {
        this(1, userAgent);
    }

    public SimpleHttpFetcherBuilder(int maxSimultaneousRequests, CrawlerUserAgent userAgent) {
        super(maxSimultaneousRequests, userAgent);
    }

    @Override
    public BaseHttpFetcher build() {
        return configure(new SimpleHttpFetcher(_maxSimultaneousRequests, _userAgent, _timeoutMs));
    }

}
