package com.scaleunlimited.politecrawler.fetcher;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.politecrawler.pojos.FetchStatus;
import com.scaleunlimited.politecrawler.pojos.FetchedPage;
import com.scaleunlimited.politecrawler.utils.ExceptionUtils;
import com.scaleunlimited.politecrawler.utils.HttpUtils;

/**
 * Fetches one page, and turns every kind of failure into a
 * {@link PageFetchException} that tells the crawler what happened.
 */
public class PageFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(PageFetcher.class);

    private final BaseHttpFetcher _fetcher;

    public PageFetcher(BaseHttpFetcher fetcher) {
        _fetcher = fetcher;
    }

    /**
     * @param url canonical URL to fetch (redirects are followed)
     * @return response with a 2xx status
     * @throws HttpFetchException if the server returned a non-2xx status
     * @throws TransportFetchException for timeouts, connection errors and the like
     */
    public FetchedPage fetch(String url) throws HttpFetchException, TransportFetchException {
        LOGGER.trace("Fetching '{}'", url);

        FetchedPage result;
        try {
            result = _fetcher.get(url);
        } catch (IOException e) {
            FetchStatus status = ExceptionUtils.mapExceptionToFetchStatus(e);
            throw new TransportFetchException(url, status, e);
        }

        int statusCode = result.getStatusCode();
        if (!HttpUtils.isSuccess(statusCode)) {
            throw new HttpFetchException(url, statusCode);
        }

        if (!result.getFetchedUrl().equals(url)) {
            LOGGER.debug("Fetched '{}' via redirect from '{}'", result.getFetchedUrl(), url);
        }

        return result;
    }

    public void close() {
        _fetcher.close();
    }
}
