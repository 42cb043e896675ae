package com.scaleunlimited.politecrawler.fetcher;

import java.io.Closeable;
import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import com.scaleunlimited.politecrawler.pojos.FetchedPage;
import com.scaleunlimited.politecrawler.utils.HttpUtils;

/**
 * Fetches a single URL. Implementations return a response for every HTTP
 * status, and only throw when there's no usable response at all.
 */
public abstract class BaseHttpFetcher implements Closeable {

    public static final int DEFAULT_MAX_CONTENT_SIZE = 10 * 1024 * 1024;
    public static final int DEFAULT_MAX_REDIRECTS = 20;

    protected final int _maxSimultaneousRequests;
    protected final CrawlerUserAgent _userAgent;

    protected int _maxContentSize = DEFAULT_MAX_CONTENT_SIZE;
    protected int _maxRedirects = DEFAULT_MAX_REDIRECTS;
    protected Set<String> _validMimeTypes = new HashSet<String>();

    public BaseHttpFetcher(int maxSimultaneousRequests, CrawlerUserAgent userAgent) {
        _maxSimultaneousRequests = maxSimultaneousRequests;
        _userAgent = userAgent;
    }

    /**
     * @param url absolute URL to fetch (redirects are followed)
     * @return response, with the body of a 2xx response capped at the max
     * content size (see {@link FetchedPage#isTruncated()})
     * @throws IOException if we never got a response, or the response has a
     * mime-type we don't want ({@link InvalidMimeTypeException})
     */
    public abstract FetchedPage get(String url) throws IOException;

    public int getMaxSimultaneousRequests() {
        return _maxSimultaneousRequests;
    }

    public CrawlerUserAgent getUserAgent() {
        return _userAgent;
    }

    public int getMaxContentSize() {
        return _maxContentSize;
    }

    public void setMaxContentSize(int maxContentSize) {
        _maxContentSize = maxContentSize;
    }

    public int getMaxRedirects() {
        return _maxRedirects;
    }

    public void setMaxRedirects(int maxRedirects) {
        _maxRedirects = maxRedirects;
    }

    public Set<String> getValidMimeTypes() {
        return _validMimeTypes;
    }

    /**
     * @param validMimeTypes mime-types we'll download, or an empty set for all of them
     */
    public void setValidMimeTypes(Set<String> validMimeTypes) {
        _validMimeTypes = new HashSet<String>(validMimeTypes);
    }

    /**
     * @param contentType Content-Type header value, or null
     * @return true if we accept every mime-type, or the header is missing
     * (so we can't tell), or its mime-type is in our set
     */
    protected boolean isValidMimeType(String contentType) {
        if (_validMimeTypes.isEmpty() || (contentType == null)) {
            return true;
        }

        return _validMimeTypes.contains(HttpUtils.getMimeTypeFromContentType(contentType));
    }

    @Override
    public void close() {
    }
}
