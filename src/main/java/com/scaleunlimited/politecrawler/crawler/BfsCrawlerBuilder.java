package com.scaleunlimited.politecrawler.crawler;

import com.scaleunlimited.politecrawler.config.CrawlConfig;
import com.scaleunlimited.politecrawler.config.CrawlTerminator;
import com.scaleunlimited.politecrawler.fetcher.BaseHttpFetcherBuilder;
import com.scaleunlimited.politecrawler.fetcher.BaseSeedProber;
import com.scaleunlimited.politecrawler.fetcher.CrawlerUserAgent;
import com.scaleunlimited.politecrawler.fetcher.DomainRateLimiter;
import com.scaleunlimited.politecrawler.fetcher.HttpSeedProber;
import com.scaleunlimited.politecrawler.fetcher.PageFetcher;
import com.scaleunlimited.politecrawler.parser.BasePageParser;
import com.scaleunlimited.politecrawler.parser.SimplePageParser;
import com.scaleunlimited.politecrawler.urls.InvalidUrlException;
import com.scaleunlimited.politecrawler.utils.CrawlToolUtils;

/**
 * Assembles a {@link BfsCrawler} from a {@link CrawlConfig}. Anything not set
 * explicitly is created from the configuration, so tests only need to swap
 * in the pieces they care about (typically the fetchers).
 */
public class BfsCrawlerBuilder {

    private CrawlConfig _config;
    private BaseHttpFetcherBuilder _robotsFetcherBuilder;
    private BaseHttpFetcherBuilder _pageFetcherBuilder;
    private BasePageParser _pageParser;
    private BaseSeedProber _seedProber;
    private CrawlTerminator _terminator;
    private DomainRateLimiter _rateLimiter;

    public BfsCrawlerBuilder(CrawlConfig config) {
        _config = config;
    }

    public BfsCrawlerBuilder setRobotsFetcherBuilder(BaseHttpFetcherBuilder robotsFetcherBuilder) {
        _robotsFetcherBuilder = robotsFetcherBuilder;
        return this;
    }

    public BfsCrawlerBuilder setPageFetcherBuilder(BaseHttpFetcherBuilder pageFetcherBuilder) {
        _pageFetcherBuilder = pageFetcherBuilder;
        return this;
    }

    public BfsCrawlerBuilder setPageParser(BasePageParser pageParser) {
        _pageParser = pageParser;
        return this;
    }

    public BfsCrawlerBuilder setSeedProber(BaseSeedProber seedProber) {
        _seedProber = seedProber;
        return this;
    }

    public BfsCrawlerBuilder setCrawlTerminator(CrawlTerminator terminator) {
        _terminator = terminator;
        return this;
    }

    /**
     * @param rateLimiter limiter whose default delay should match the
     * configuration (the crawl session connects it to the robots.txt cache)
     * @return this builder
     */
    public BfsCrawlerBuilder setRateLimiter(DomainRateLimiter rateLimiter) {
        _rateLimiter = rateLimiter;
        return this;
    }

    /**
     * @return crawler that's ready to run
     * @throws InvalidUrlException if the seed URL isn't a valid http(s) URL
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public BfsCrawler build() throws InvalidUrlException {
        _config.validate();

        CrawlerUserAgent userAgent = CrawlToolUtils.getUserAgent(_config);

        BaseHttpFetcherBuilder robotsFetcherBuilder = _robotsFetcherBuilder;
        if (robotsFetcherBuilder == null) {
            robotsFetcherBuilder = CrawlToolUtils.getRobotsFetcherBuilder(_config, userAgent);
        }

        BaseHttpFetcherBuilder pageFetcherBuilder = _pageFetcherBuilder;
        if (pageFetcherBuilder == null) {
            pageFetcherBuilder = CrawlToolUtils.getPageFetcherBuilder(_config, userAgent);
        }

        BasePageParser pageParser = _pageParser;
        if (pageParser == null) {
            pageParser = new SimplePageParser(_config.getMaxOutlinksPerPage());
        }

        BaseSeedProber seedProber = _seedProber;
        if (seedProber == null) {
            seedProber = new HttpSeedProber(_config.getUserAgent(), _config.getProbeTimeoutMs());
        }

        CrawlTerminator terminator = _terminator;
        if (terminator == null) {
            terminator = _config.makeTerminator();
        }

        CrawlSession session = new CrawlSession(_config, robotsFetcherBuilder.build(), _rateLimiter);
        return new BfsCrawler(session, new PageFetcher(pageFetcherBuilder.build()), pageParser,
                seedProber, terminator);
    }
}
