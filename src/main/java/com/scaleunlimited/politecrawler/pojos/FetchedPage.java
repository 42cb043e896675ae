package com.scaleunlimited.politecrawler.pojos;

import java.util.Locale;

/**
 * Response for a page or robots.txt request. Only the body of a 2xx
 * response is kept.
 */
public class FetchedPage {

    private String _requestedUrl;
    private String _fetchedUrl;
    private int _statusCode;
    private String _contentType;
    private byte[] _content;
    private long _fetchTime;
    private boolean _truncated;

    public FetchedPage(String requestedUrl, String fetchedUrl, int statusCode, String contentType,
            byte[] content, long fetchTime) {
        this(requestedUrl, fetchedUrl, statusCode, contentType, content, fetchTime, false);
    }

    public FetchedPage(String requestedUrl, String fetchedUrl, int statusCode, String contentType,
            byte[] content, long fetchTime, boolean truncated) {
        _requestedUrl = requestedUrl;
        _fetchedUrl = fetchedUrl;
        _statusCode = statusCode;
        _contentType = contentType;
        _content = content;
        _fetchTime = fetchTime;
        _truncated = truncated;
    }

    public String getRequestedUrl() {
        return _requestedUrl;
    }

    /**
     * @return URL after following redirects, used as the base for resolving links
     */
    public String getFetchedUrl() {
        return _fetchedUrl;
    }

    public int getStatusCode() {
        return _statusCode;
    }

    public String getContentType() {
        return _contentType;
    }

    public byte[] getContent() {
        return _content;
    }

    public long getFetchTime() {
        return _fetchTime;
    }

    /**
     * @return true if the body was longer than the fetcher's max content
     * size, and we only have the start of it
     */
    public boolean isTruncated() {
        return _truncated;
    }

    public boolean isHtml() {
        if (_contentType == null) {
            return false;
        }

        String contentType = _contentType.toLowerCase(Locale.ROOT);
        return contentType.contains("text/html") || contentType.contains("application/xhtml+xml");
    }

    @Override
    public String toString() {
        return String.format("%s (%d, %s, %d bytes%s)", _fetchedUrl, _statusCode, _contentType,
                (_content == null) ? 0 : _content.length, _truncated ? ", truncated" : "");
    }
}
