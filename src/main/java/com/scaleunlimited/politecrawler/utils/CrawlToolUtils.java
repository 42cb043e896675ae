package com.scaleunlimited.politecrawler.utils;

import java.text.SimpleDateFormat;
import java.util.Arrays;
import java.util.Date;
import java.util.HashSet;
import java.util.Set;

import com.scaleunlimited.politecrawler.config.CrawlConfig;
import com.scaleunlimited.politecrawler.fetcher.BaseHttpFetcherBuilder;
import com.scaleunlimited.politecrawler.fetcher.CrawlerUserAgent;
import com.scaleunlimited.politecrawler.fetcher.SimpleHttpFetcherBuilder;
import com.scaleunlimited.politecrawler.robots.RobotsPolicyCache;

public class CrawlToolUtils {

    private static final String TIMESTAMP_FORMAT = "yyyy-MM-dd HH:mm:ss";
    private static final String FILENAME_TIMESTAMP_FORMAT = "yyyyMMdd-HHmmss";

    // Anything else is skipped without downloading the body.
    public static final Set<String> PAGE_MIME_TYPES = new HashSet<>(Arrays.asList("text/html",
            "application/xhtml+xml"));

    public static CrawlerUserAgent getUserAgent(CrawlConfig config) {
        return new CrawlerUserAgent(config.getRobotsAgentName(), config.getUserAgent());
    }

    public static BaseHttpFetcherBuilder getPageFetcherBuilder(CrawlConfig config, CrawlerUserAgent userAgent) {
        return new SimpleHttpFetcherBuilder(userAgent)
                .setMaxContentSize(config.getMaxContentSize())
                .setValidMimeTypes(PAGE_MIME_TYPES)
                .setTimeoutMs(config.getFetchTimeoutMs());
    }

    public static BaseHttpFetcherBuilder getRobotsFetcherBuilder(CrawlConfig config, CrawlerUserAgent userAgent) {
        return new SimpleHttpFetcherBuilder(userAgent)
                .setMaxContentSize(RobotsPolicyCache.MAX_ROBOTS_TXT_SIZE)
                .setTimeoutMs(config.getRobotsTimeoutMs());
    }

    /**
     * @param time epoch milliseconds
     * @return local time formatted as "yyyy-MM-dd HH:mm:ss"
     */
    public static String formatTimestamp(long time) {
        return new SimpleDateFormat(TIMESTAMP_FORMAT).format(new Date(time));
    }

    public static String makePartialResultsFilename(long time) {
        return String.format("partial-%s.json", new SimpleDateFormat(FILENAME_TIMESTAMP_FORMAT).format(new Date(time)));
    }
}
