package com.scaleunlimited.politecrawler.pojos;

/**
 * One successfully fetched and parsed page. Created by the crawler and never
 * modified afterwards.
 */
public class CrawlResult {

    private final String _url;
    private final String _domain;
    private final int _depth;
    private final ParsedPage _page;
    private final int _httpStatus;
    private final long _fetchTime;

    public CrawlResult(String url, String domain, int depth, ParsedPage page, int httpStatus, long fetchTime) {
        _url = url;
        _domain = domain;
        _depth = depth;
        _page = page;
        _httpStatus = httpStatus;
        _fetchTime = fetchTime;
    }

    public String getUrl() {
        return _url;
    }

    public String getDomain() {
        return _domain;
    }

    public int getDepth() {
        return _depth;
    }

    public ParsedPage getPage() {
        return _page;
    }

    public int getHttpStatus() {
        return _httpStatus;
    }

    /**
     * @return time (epoch milliseconds) when the request was started
     */
    public long getFetchTime() {
        return _fetchTime;
    }

    @Override
    public String toString() {
        return String.format("%s [%d] %s", _url, _httpStatus, _page);
    }
}
