package com.scaleunlimited.politecrawler.fetcher;

import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URI;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.politecrawler.pojos.FetchedPage;
import com.scaleunlimited.politecrawler.utils.HttpUtils;

/**
 * Fetcher that uses Apache HttpClient. Redirects are followed (up to the max
 * redirects), and the URL we ended up at is returned as the fetched URL.
 *
 * Only the body of a 2xx response is downloaded. If it's longer than the max
 * content size we keep what we've read, drop the connection, and flag the
 * result as truncated.
 */
public class SimpleHttpFetcher extends BaseHttpFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(SimpleHttpFetcher.class);

    private final int _timeoutMs;

    private CloseableHttpClient _client;

    /**
     * @param maxSimultaneousRequests size of the connection pool
     * @param userAgent sent with every request
     * @param timeoutMs max time to wait for a connection, and for data once connected
     */
    public SimpleHttpFetcher(int maxSimultaneousRequests, CrawlerUserAgent userAgent, int timeoutMs) {
        super(maxSimultaneousRequests, userAgent);

        _timeoutMs = timeoutMs;
    }

    @Override
    public FetchedPage get(String url) throws IOException {
        HttpGet request;
        try {
            request = new HttpGet(url);
        } catch (IllegalArgumentException e) {
            throw new MalformedURLException(String.format("Invalid URL '%s': %s", url, e.getMessage()));
        }

        HttpClientContext context = HttpClientContext.create();
        long fetchTime = System.currentTimeMillis();

        try (CloseableHttpResponse response = getClient().execute(request, context)) {
            int statusCode = response.getStatusLine().getStatusCode();
            String fetchedUrl = getRedirectedUrl(url, context);

            HttpEntity entity = response.getEntity();
            String contentType = null;
            if (entity != null) {
                Header contentTypeHeader = entity.getContentType();
                if (contentTypeHeader != null) {
                    contentType = contentTypeHeader.getValue();
                }
            }

            // We don't need the body of an error response.
            if ((entity == null) || !HttpUtils.isSuccess(statusCode)) {
                return new FetchedPage(url, fetchedUrl, statusCode, contentType, new byte[0], fetchTime);
            }

            if (!isValidMimeType(contentType)) {
                request.abort();
                throw new InvalidMimeTypeException(fetchedUrl, contentType);
            }

            // Read one byte more than we want, so we know if there's more.
            InputStream in = entity.getContent();
            byte[] content = IOUtils.toByteArray(new BoundedInputStream(in, _maxContentSize + 1L));
            if (content.length <= _maxContentSize) {
                in.close();
                return new FetchedPage(url, fetchedUrl, statusCode, contentType, content, fetchTime);
            }

            // Closing the stream would read (and discard) the rest of the body.
            request.abort();
            LOGGER.warn("Content of {} is longer than {} bytes, truncating", fetchedUrl, _maxContentSize);
            return new FetchedPage(url, fetchedUrl, statusCode, contentType,
                    Arrays.copyOf(content, _maxContentSize), fetchTime, true);
        }
    }

    private String getRedirectedUrl(String url, HttpClientContext context) {
        List<URI> redirects = context.getRedirectLocations();
        if ((redirects == null) || redirects.isEmpty()) {
            return url;
        }

        String redirectedUrl = redirects.get(redirects.size() - 1).toString();
        LOGGER.trace("Redirected from '{}' to '{}'", url, redirectedUrl);
        return redirectedUrl;
    }

    private synchronized CloseableHttpClient getClient() {
        if (_client == null) {
            PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
            connectionManager.setMaxTotal(_maxSimultaneousRequests);
            connectionManager.setDefaultMaxPerRoute(_maxSimultaneousRequests);

            RequestConfig requestConfig = RequestConfig.custom()
                    .setConnectTimeout(_timeoutMs)
                    .setConnectionRequestTimeout(_timeoutMs)
                    .setSocketTimeout(_timeoutMs)
                    .setRedirectsEnabled(true)
                    .setMaxRedirects(_maxRedirects)
                    .setCircularRedirectsAllowed(false)
                    .build();

            _client = HttpClients.custom()
                    .setConnectionManager(connectionManager)
                    .setUserAgent(_userAgent.getUserAgentString())
                    .setDefaultRequestConfig(requestConfig)
                    .build();
        }

        return _client;
    }

    public int getTimeoutMs() {
        return _timeoutMs;
    }

    @Override
    public synchronized void close() {
        if (_client == null) {
            return;
        }

        try {
            _client.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing HTTP client", e);
        } finally {
            _client = null;
        }
    }
}
