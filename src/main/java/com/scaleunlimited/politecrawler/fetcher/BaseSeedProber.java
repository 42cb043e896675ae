package com.scaleunlimited.politecrawler.fetcher;

/**
 * Checks that the seed URL responds before the crawl starts. Probing is
 * informational only; a failed probe never stops the crawl.
 */
public abstract class BaseSeedProber {

    public static final int PROBE_FAILED = -1;

    /**
     * @param url seed URL
     * @return HTTP status of the probe, or {@link #PROBE_FAILED} if we got no response
     */
    public abstract int probe(String url);

    public void close() {
    }
}
