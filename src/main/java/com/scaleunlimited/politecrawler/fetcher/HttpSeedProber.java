package com.scaleunlimited.politecrawler.fetcher;

import java.io.IOException;

import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpHead;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends a HEAD request to the seed, falling back to a GET (where we only
 * read the status line) if the server doesn't support HEAD or returns an
 * error for it.
 */
public class HttpSeedProber extends BaseSeedProber {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpSeedProber.class);

    private final CloseableHttpClient _client;

    public HttpSeedProber(String userAgent, int timeoutMs) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMs)
                .setConnectionRequestTimeout(timeoutMs)
                .setSocketTimeout(timeoutMs)
                .setRedirectsEnabled(true)
                .build();

        _client = HttpClients.custom()
                .setUserAgent(userAgent)
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    @Override
    public int probe(String url) {
        int status = execute(new HttpHead(url));
        if ((status == PROBE_FAILED) || (status == HttpStatus.SC_METHOD_NOT_ALLOWED) || (status >= 400)) {
            LOGGER.debug("HEAD probe of {} returned {}, trying GET", url, status);
            status = execute(new HttpGet(url));
        }

        if (status == PROBE_FAILED) {
            LOGGER.warn("Could not reach start URL {}", url);
        } else {
            LOGGER.info("Start URL {} responded with status {}", url, status);
        }

        return status;
    }

    private int execute(HttpRequestBase request) {
        // Closing the response without consuming the entity aborts the
        // connection, so we never download the body.
        try (CloseableHttpResponse response = _client.execute(request)) {
            return response.getStatusLine().getStatusCode();
        } catch (IOException e) {
            LOGGER.debug(String.format("%s probe of %s failed", request.getMethod(), request.getURI()), e);
            return PROBE_FAILED;
        }
    }

    @Override
    public void close() {
        try {
            _client.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing seed probe client", e);
        }
    }
}
