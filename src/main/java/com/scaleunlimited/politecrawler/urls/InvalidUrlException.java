package com.scaleunlimited.politecrawler.urls;

import java.net.MalformedURLException;

/**
 * Thrown when a URL reference can't be turned into a canonical, crawlable
 * http(s) URL. The caller drops the single link and carries on.
 */
@SuppressWarnings("serial")
public class InvalidUrlException extends MalformedURLException {

    private final String _reference;

    public InvalidUrlException(String reference, String msg) {
        super(String.format("%s: '%s'", msg, reference));

        _reference = reference;
    }

    public String getReference() {
        return _reference;
    }
}
