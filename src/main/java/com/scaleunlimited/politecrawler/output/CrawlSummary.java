package com.scaleunlimited.politecrawler.output;

import java.io.PrintStream;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.scaleunlimited.politecrawler.crawler.BfsCrawler;
import com.scaleunlimited.politecrawler.pojos.CrawlResult;

/**
 * Statistics for a finished (or cancelled) crawl.
 */
public class CrawlSummary {

    private static final String RULE = "==================================================";

    private final int _pagesScraped;
    private final int _urlsVisited;
    private final Set<String> _domains = new LinkedHashSet<>();
    private final int _totalLinks;
    private final int _totalImages;
    private final boolean _respectRobots;
    private final Map<String, Long> _crawlDelays;

    public CrawlSummary(BfsCrawler crawler) {
        this(crawler.getResults(), crawler.getVisitedCount(),
                crawler.getSession().getRobotsCache().isRespectRobots(),
                crawler.getSession().getRobotsCache().getCrawlDelays());
    }

    public CrawlSummary(List<CrawlResult> results, int urlsVisited, boolean respectRobots,
            Map<String, Long> crawlDelays) {
        _pagesScraped = results.size();
        _urlsVisited = urlsVisited;
        _respectRobots = respectRobots;
        _crawlDelays = crawlDelays;

        int totalLinks = 0;
        int totalImages = 0;
        for (CrawlResult result : results) {
            _domains.add(result.getDomain());
            totalLinks += result.getPage().getLinks().size();
            totalImages += result.getPage().getImages().size();
        }

        _totalLinks = totalLinks;
        _totalImages = totalImages;
    }

    public void print(PrintStream out) {
        if (_pagesScraped == 0) {
            return;
        }

        out.println();
        out.println(RULE);
        out.println("CRAWL SUMMARY");
        out.println(RULE);
        out.println("Pages scraped: " + _pagesScraped);
        out.println("URLs visited: " + _urlsVisited);
        out.println("Domains: " + String.join(", ", _domains));
        out.println("Total links found: " + _totalLinks);
        out.println("Total images found: " + _totalImages);
        out.println("Robots.txt compliance: " + (_respectRobots ? "Enabled" : "Disabled"));

        if (!_crawlDelays.isEmpty()) {
            StringBuilder delays = new StringBuilder();
            for (Map.Entry<String, Long> entry : _crawlDelays.entrySet()) {
                if (delays.length() > 0) {
                    delays.append(", ");
                }

                delays.append(String.format(Locale.ROOT, "%s=%.1fs", entry.getKey(), entry.getValue() / 1000.0));
            }

            out.println("Custom crawl delays: " + delays);
        }
    }

    public int getPagesScraped() {
        return _pagesScraped;
    }

    public int getUrlsVisited() {
        return _urlsVisited;
    }

    public Set<String> getDomains() {
        return _domains;
    }

    public int getTotalLinks() {
        return _totalLinks;
    }

    public int getTotalImages() {
        return _totalImages;
    }

    public Map<String, Long> getCrawlDelays() {
        return _crawlDelays;
    }
}
