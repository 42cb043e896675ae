package com.scaleunlimited.politecrawler.utils;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.MalformedURLException;
import java.net.SocketTimeoutException;

import org.apache.http.HttpStatus;
import org.apache.http.client.ClientProtocolException;
import org.apache.http.client.RedirectException;
import org.apache.http.conn.ConnectTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.politecrawler.fetcher.InvalidMimeTypeException;
import com.scaleunlimited.politecrawler.pojos.FetchStatus;

public class ExceptionUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExceptionUtils.class);

    public static FetchStatus mapHttpStatusToFetchStatus(int httpStatus) {
        switch (httpStatus) {
            case HttpStatus.SC_OK:
                return FetchStatus.FETCHED;

            case 429: // Too many requests
                return FetchStatus.RATE_LIMITED;

            case HttpStatus.SC_FORBIDDEN:
                return FetchStatus.HTTP_FORBIDDEN;

            case HttpStatus.SC_UNAUTHORIZED:
            case HttpStatus.SC_PROXY_AUTHENTICATION_REQUIRED:
                return FetchStatus.HTTP_UNAUTHORIZED;

            case HttpStatus.SC_NOT_FOUND:
                return FetchStatus.HTTP_NOT_FOUND;

            case HttpStatus.SC_GONE:
                return FetchStatus.HTTP_GONE;

            default:
                if (httpStatus < 300) {
                    LOGGER.warn("Invalid HTTP status for exception: " + httpStatus);
                    return FetchStatus.HTTP_SERVER_ERROR;
                } else if (httpStatus < 400) {
                    return FetchStatus.HTTP_REDIRECTION_ERROR;
                } else if (httpStatus < 500) {
                    return FetchStatus.HTTP_CLIENT_ERROR;
                } else if (httpStatus < 600) {
                    return FetchStatus.HTTP_SERVER_ERROR;
                } else {
                    LOGGER.warn("Unknown status: " + httpStatus);
                    return FetchStatus.HTTP_SERVER_ERROR;
                }
        }
    }

    /**
     * Map a transport-level failure (anything other than an HTTP status
     * error) to the status we record for the URL.
     * 
     * @param e exception thrown by the fetcher
     * @return matching status
     */
    public static FetchStatus mapExceptionToFetchStatus(Exception e) {

        if (e instanceof InvalidMimeTypeException) {
            return FetchStatus.SKIPPED_NOT_HTML;
        } else if (isTimeout(e)) {
            return FetchStatus.ERROR_TIMEOUT;
        } else if (e instanceof InterruptedIOException) {
            // HttpClient's RequestAbortedException, when the fetching thread is interrupted.
            return FetchStatus.SKIPPED_INTERRUPTED;
        } else if ((e instanceof ClientProtocolException) && (e.getCause() instanceof RedirectException)) {
            LOGGER.debug("Redirect error: {}", e.getCause().getMessage());
            return FetchStatus.HTTP_REDIRECTION_ERROR;
        } else if (e instanceof MalformedURLException) {
            return FetchStatus.ERROR_INVALID_URL;
        } else if (e instanceof IOException) {
            return FetchStatus.ERROR_IOEXCEPTION;
        }

        LOGGER.warn("Unknown exception: " + e.getMessage());
        return FetchStatus.ERROR_UNKNOWN;
    }

    private static boolean isTimeout(Throwable t) {
        return (t instanceof SocketTimeoutException) || (t instanceof ConnectTimeoutException)
                || ((t instanceof InterruptedIOException) && (t.getMessage() != null)
                        && t.getMessage().toLowerCase().contains("timed out"));
    }
}
