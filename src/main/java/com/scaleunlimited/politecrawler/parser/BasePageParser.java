package com.scaleunlimited.politecrawler.parser;

import java.net.MalformedURLException;
import java.net.URL;

import com.scaleunlimited.politecrawler.pojos.FetchedPage;

public abstract class BasePageParser {

    public static final int DEFAULT_MAX_OUTLINKS = 1000;

    private int _maxOutlinks;

    public BasePageParser() {
        this(DEFAULT_MAX_OUTLINKS);
    }

    public BasePageParser(int maxOutlinks) {
        _maxOutlinks = maxOutlinks;
    }

    public int getMaxOutlinks() {
        return _maxOutlinks;
    }

    public void open() throws Exception {
    }

    public void close() throws Exception {
    }

    public abstract ParserResult parse(FetchedPage page) throws Exception;

    /**
     * Figure out the right base URL to use, for when we need to resolve relative URLs.
     * 
     * @param page fetched page
     * @return the base URL (the final URL, after any redirects)
     * @throws MalformedURLException
     */
    protected URL getContentLocation(FetchedPage page) throws MalformedURLException {
        return new URL(page.getFetchedUrl());
    }
}
