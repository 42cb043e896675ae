package com.scaleunlimited.politecrawler.crawler;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.politecrawler.config.CrawlConfig;
import com.scaleunlimited.politecrawler.config.CrawlTerminator;
import com.scaleunlimited.politecrawler.fetcher.BaseSeedProber;
import com.scaleunlimited.politecrawler.fetcher.HttpFetchException;
import com.scaleunlimited.politecrawler.fetcher.PageFetcher;
import com.scaleunlimited.politecrawler.fetcher.TransportFetchException;
import com.scaleunlimited.politecrawler.metrics.CrawlerMetrics;
import com.scaleunlimited.politecrawler.parser.BasePageParser;
import com.scaleunlimited.politecrawler.parser.ParserResult;
import com.scaleunlimited.politecrawler.pojos.CrawlResult;
import com.scaleunlimited.politecrawler.pojos.FetchStatus;
import com.scaleunlimited.politecrawler.pojos.FetchedPage;
import com.scaleunlimited.politecrawler.pojos.FrontierEntry;
import com.scaleunlimited.politecrawler.urls.InvalidUrlException;
import com.scaleunlimited.politecrawler.urls.UrlCanonicalizer;
import com.scaleunlimited.politecrawler.utils.FrontierQueue;

/**
 * Breadth-first crawl from a single seed URL. One page is fetched at a
 * time. For each entry taken off the frontier we skip it if it's been
 * visited or is too deep, check it against robots.txt, patterns and domain
 * scope (the seed only needs robots.txt), wait for the domain's rate limit,
 * then fetch and parse it. Outlinks of pages above the max depth go onto the
 * end of the frontier.
 * 
 * A failure on one page never stops the crawl. The only fatal condition is
 * a seed URL that robots.txt disallows, which puts the crawl in the
 * {@link CrawlState#ABORTED} state without fetching anything.
 * 
 * Results, visited URLs and counters can be read at any time, including
 * after the crawl was cancelled.
 */
public class BfsCrawler {
    private static final Logger LOGGER = LoggerFactory.getLogger(BfsCrawler.class);

    public static final int PROGRESS_INTERVAL = 10;

    private final CrawlSession _session;
    private final PageFetcher _pageFetcher;
    private final BasePageParser _parser;
    private final BaseSeedProber _seedProber;
    private final CrawlTerminator _terminator;
    private final FrontierQueue _frontier;

    private final List<CrawlResult> _results = new CopyOnWriteArrayList<>();
    private volatile CrawlState _state = CrawlState.IDLE;

    public BfsCrawler(CrawlSession session, PageFetcher pageFetcher, BasePageParser parser,
            BaseSeedProber seedProber, CrawlTerminator terminator) {
        _session = session;
        _pageFetcher = pageFetcher;
        _parser = parser;
        _seedProber = seedProber;
        _terminator = terminator;
        _frontier = new FrontierQueue(session.getConfig().getMaxQueueSize());
        _frontier.open();
    }

    /**
     * Run the crawl to completion (or until the terminator fires).
     * 
     * @return final state of the crawl
     * @throws Exception if the page parser can't be initialized
     */
    public CrawlState crawl() throws Exception {
        if (_state != CrawlState.IDLE) {
            throw new IllegalStateException("Crawl has already been run, state is " + _state);
        }

        _state = CrawlState.RUNNING;

        CrawlConfig config = _session.getConfig();
        String seedUrl = _session.getSeedUrl();
        LOGGER.info("Starting crawl of {} (max depth {}, delay {}ms, robots.txt {})", seedUrl,
                config.getMaxDepth(), config.getDefaultCrawlDelayMs(),
                config.isRespectRobots() ? "respected" : "ignored");

        _parser.open();
        _terminator.open();

        try {
            _seedProber.probe(seedUrl);

            if (!_session.getRobotsCache().canFetch(seedUrl)) {
                LOGGER.error("Start URL {} is disallowed by robots.txt, aborting crawl", seedUrl);
                _state = CrawlState.ABORTED;
                return _state;
            }

            if (!_session.getPatternFilter().isAllowedByPatterns(seedUrl)) {
                LOGGER.warn("Start URL {} doesn't match the include/exclude patterns, crawling it anyway", seedUrl);
            }

            _frontier.add(new FrontierEntry(seedUrl, 0));
            runLoop();
        } catch (InterruptedException e) {
            LOGGER.warn("Crawl interrupted");
            Thread.currentThread().interrupt();
            _state = CrawlState.CANCELLED;
        } finally {
            _seedProber.close();
            _parser.close();
            _pageFetcher.close();
            _session.getRobotsCache().close();
        }

        if (_state == CrawlState.RUNNING) {
            _state = CrawlState.COMPLETED;
        }

        LOGGER.info("Crawl {}: {} pages scraped, {} URLs visited", _state.name().toLowerCase(),
                _results.size(), _session.getVisitedCount());
        return _state;
    }

    private void runLoop() throws InterruptedException {
        while (!_frontier.isEmpty()) {
            if (_terminator.isTerminated()) {
                LOGGER.info("Stopping crawl with {} URLs left in the queue", _frontier.size());
                _state = CrawlState.CANCELLED;
                return;
            }

            FrontierEntry entry = _frontier.poll();
            try {
                processEntry(entry);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                LOGGER.error(String.format("Unexpected error processing '%s'", entry.getUrl()), e);
                _session.getCounters().increment(FetchStatus.ERROR_UNKNOWN);
            }
        }
    }

    private void processEntry(FrontierEntry entry) throws InterruptedException {
        final String url = entry.getUrl();
        final int depth = entry.getDepth();

        if (_session.isVisited(url)) {
            _session.getCounters().increment(FetchStatus.SKIPPED_VISITED);
            return;
        }

        if (depth > _session.getConfig().getMaxDepth()) {
            LOGGER.trace("Skipping {}, too deep", entry);
            _session.getCounters().increment(FetchStatus.SKIPPED_DEPTH);
            return;
        }

        // The seed has already been checked against robots.txt, is always in
        // scope, and isn't subject to the URL patterns.
        if ((depth > 0) && !_session.getAdmission().admit(url)) {
            return;
        }

        if (!_session.markVisited(url)) {
            _session.getCounters().increment(FetchStatus.SKIPPED_VISITED);
            return;
        }

        String domain = UrlCanonicalizer.getDomain(url);
        if (_session.getRateLimiter().waitIfNeeded(domain) > 0) {
            _session.getCounters().increment(CrawlerMetrics.COUNTER_RATE_LIMIT_WAITS);
        }

        FetchedPage page = fetch(url, domain);
        if (page == null) {
            return;
        }

        if (!page.isHtml()) {
            LOGGER.debug("Skipping non-HTML content: {} ({})", url, page.getContentType());
            _session.getCounters().increment(FetchStatus.SKIPPED_NOT_HTML);
            return;
        }

        ParserResult parsed;
        try {
            parsed = _parser.parse(page);
            _session.getCounters().increment(CrawlerMetrics.COUNTER_PAGES_PARSED);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            LOGGER.error(String.format("Error parsing '%s'", url), e);
            _session.getCounters().increment(CrawlerMetrics.COUNTER_PAGES_FAILEDPARSE);
            _session.getCounters().increment(FetchStatus.ERROR_PARSE);
            return;
        }

        _results.add(new CrawlResult(url, domain, depth, parsed.getParsedPage(),
                page.getStatusCode(), page.getFetchTime()));
        _session.getCounters().increment(FetchStatus.FETCHED);
        LOGGER.debug("Scraped {} (depth {}): {}", url, depth, parsed.getParsedPage());

        if ((_results.size() % PROGRESS_INTERVAL) == 0) {
            LOGGER.info("Progress: {} pages scraped, {} URLs in queue", _results.size(), _frontier.size());
        }

        if (depth < _session.getConfig().getMaxDepth()) {
            enqueueOutlinks(parsed.getOutlinks(), page.getFetchedUrl(), depth + 1);
        }
    }

    /**
     * @return the fetched page, or null if the fetch failed (which has
     * already been logged and counted)
     */
    private FetchedPage fetch(String url, String domain) throws InterruptedException {
        LOGGER.info("Scraping: {}", url);

        try {
            return _pageFetcher.fetch(url);
        } catch (HttpFetchException e) {
            _session.getCounters().increment(e.getFetchStatus());
            if (e.isRateLimited()) {
                LOGGER.warn("Rate limited on {}, waiting extra time...", url);
                _session.getRateLimiter().backOff(domain, _session.getConfig().getRateLimitedBackoffMs());
            } else {
                LOGGER.warn("HTTP error {} fetching {}", e.getHttpStatus(), url);
            }
        } catch (TransportFetchException e) {
            FetchStatus status = e.getFetchStatus();
            _session.getCounters().increment(status);
            if (status == FetchStatus.SKIPPED_NOT_HTML) {
                LOGGER.debug("Skipping non-HTML content: {}", url);
            } else if (status == FetchStatus.SKIPPED_INTERRUPTED) {
                throw new InterruptedException("Interrupted while fetching " + url);
            } else if (e.isTimeout()) {
                LOGGER.warn("Timeout fetching {}", url);
            } else {
                LOGGER.warn("Error fetching {}: {}", url, e.getMessage());
            }
        }

        return null;
    }

    private void enqueueOutlinks(List<String> outlinks, String baseUrl, int depth) {
        LOGGER.debug("Found {} links on {}", outlinks.size(), baseUrl);
        _session.getCounters().increment(CrawlerMetrics.COUNTER_LINKS_FOUND, outlinks.size());

        UrlCanonicalizer canonicalizer = _session.getCanonicalizer();
        Set<String> pageLinks = new LinkedHashSet<>();
        for (String outlink : outlinks) {
            try {
                pageLinks.add(canonicalizer.canonicalize(outlink, baseUrl));
            } catch (InvalidUrlException e) {
                LOGGER.trace("Dropping invalid link: {}", e.getMessage());
                _session.getCounters().increment(CrawlerMetrics.COUNTER_LINKS_INVALID);
            }
        }

        for (String link : pageLinks) {
            if (_session.isVisited(link)) {
                continue;
            }

            // Patterns are cheap and have no side effects, so filter them here to
            // keep excluded URLs out of the frontier. Everything else is checked
            // when the entry is dequeued.
            if (!_session.getPatternFilter().isAllowedByPatterns(link)) {
                _session.getCounters().increment(FetchStatus.SKIPPED_FILTERED);
                continue;
            }

            FrontierEntry rejected = _frontier.add(new FrontierEntry(link, depth));
            if (rejected != null) {
                LOGGER.trace("Frontier full, dropping {}", rejected);
                _session.getCounters().increment(FetchStatus.SKIPPED_QUEUE_FULL);
            } else {
                _session.getCounters().increment(CrawlerMetrics.COUNTER_LINKS_QUEUED);
            }
        }
    }

    public CrawlState getState() {
        return _state;
    }

    /**
     * @return snapshot of the results so far, in fetch order
     */
    public List<CrawlResult> getResults() {
        return new ArrayList<>(_results);
    }

    public int getVisitedCount() {
        return _session.getVisitedCount();
    }

    public int getQueueSize() {
        return _frontier.size();
    }

    public CrawlSession getSession() {
        return _session;
    }

    public CrawlTerminator getTerminator() {
        return _terminator;
    }
}
