package com.scaleunlimited.politecrawler.fetcher;

import java.io.IOException;

/**
 * The server sent content we don't want, so we dropped the connection
 * without downloading the body.
 */
@SuppressWarnings("serial")
public class InvalidMimeTypeException extends IOException {

    private final String _url;
    private final String _contentType;

    public InvalidMimeTypeException(String url, String contentType) {
        super(String.format("Invalid mime-type '%s' for %s", contentType, url));

        _url = url;
        _contentType = contentType;
    }

    public String getUrl() {
        return _url;
    }

    public String getContentType() {
        return _contentType;
    }
}
