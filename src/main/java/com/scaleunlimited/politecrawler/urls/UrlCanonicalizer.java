package com.scaleunlimited.politecrawler.urls;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import crawlercommons.filters.basic.BasicURLNormalizer;

/**
 * Turns a (possibly relative) URL reference into the canonical form that we
 * use as the key for the visited set: absolute, http or https only, lower-case
 * scheme and host, no default port, no query, no fragment, and an empty path
 * replaced by "/".
 * 
 * Canonicalization is idempotent, so canonicalize(canonicalize(u)) equals
 * canonicalize(u).
 */
public class UrlCanonicalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(UrlCanonicalizer.class);

    private final BasicURLNormalizer _normalizer = new BasicURLNormalizer();

    public String canonicalize(String url) throws InvalidUrlException {
        return canonicalize(url, null);
    }

    /**
     * @param reference absolute or relative URL
     * @param base URL to resolve <code>reference</code> against, or null
     * @return canonical absolute URL
     * @throws InvalidUrlException if the result isn't a valid http(s) URL
     */
    public String canonicalize(String reference, String base) throws InvalidUrlException {
        if (reference == null) {
            throw new InvalidUrlException(reference, "Missing URL");
        }

        String trimmed = reference.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidUrlException(reference, "Empty URL");
        }

        URL url;
        try {
            url = (base == null) ? new URL(trimmed) : new URL(new URL(base), trimmed);
        } catch (MalformedURLException e) {
            throw new InvalidUrlException(reference, "Malformed URL");
        }

        String protocol = url.getProtocol().toLowerCase(Locale.ROOT);
        if (!protocol.equals("http") && !protocol.equals("https")) {
            throw new InvalidUrlException(reference, "Unsupported protocol");
        }

        String hostname = url.getHost();
        if ((hostname == null) || hostname.isEmpty()) {
            throw new InvalidUrlException(reference, "Missing hostname");
        }

        hostname = hostname.toLowerCase(Locale.ROOT);
        int port = url.getPort();
        if (port == url.getDefaultPort()) {
            port = -1;
        }

        String path = url.getPath();
        if (path.isEmpty()) {
            path = "/";
        }

        path = path.replace(" ", "%20");

        String stripped;
        if (port == -1) {
            stripped = String.format("%s://%s%s", protocol, hostname, path);
        } else {
            stripped = String.format("%s://%s:%d%s", protocol, hostname, port, path);
        }

        String result = _normalizer.filter(stripped);
        if (result == null) {
            throw new InvalidUrlException(reference, "Normalization failed");
        }

        LOGGER.trace("Canonicalized '{}' to '{}'", reference, result);
        return result;
    }

    /**
     * @param url a valid absolute URL (normally one we've already canonicalized)
     * @return the host name, plus the port if it's not the scheme's default
     */
    public static String getDomain(String url) {
        try {
            URL parsed = new URL(url);
            String hostname = parsed.getHost().toLowerCase(Locale.ROOT);
            int port = parsed.getPort();
            if ((port == -1) || (port == parsed.getDefaultPort())) {
                return hostname;
            } else {
                return String.format("%s:%d", hostname, port);
            }
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Can't extract domain from invalid URL: " + url, e);
        }
    }

    /**
     * @param url a valid absolute URL
     * @return the lower-cased scheme (protocol) of the URL
     */
    public static String getScheme(String url) {
        try {
            return new URL(url).getProtocol().toLowerCase(Locale.ROOT);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Can't extract scheme from invalid URL: " + url, e);
        }
    }
}
