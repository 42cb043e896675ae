package com.scaleunlimited.politecrawler.fetcher;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.politecrawler.robots.RobotsPolicyCache;

/**
 * Spaces out requests to the same domain. The delay for a domain is the
 * larger of the default delay and the crawl delay from its robots.txt (if
 * we've loaded it). Time is measured between request starts.
 * 
 * Each domain has its own lock, so waiting on one domain never blocks a
 * caller that's fetching from a different domain.
 */
public class DomainRateLimiter {
    private static final Logger LOGGER = LoggerFactory.getLogger(DomainRateLimiter.class);

    private static final long NEVER_FETCHED = -1L;

    private static class DomainRateState {
        private long _lastFetchTime = NEVER_FETCHED;
    }

    private final long _defaultDelayMs;
    private RobotsPolicyCache _robotsCache;

    private final Map<String, DomainRateState> _states = new ConcurrentHashMap<>();

    public DomainRateLimiter(long defaultDelayMs) {
        this(defaultDelayMs, null);
    }

    /**
     * @param defaultDelayMs minimum time between requests to the same domain
     * @param robotsCache source of robots.txt crawl delays, or null
     */
    public DomainRateLimiter(long defaultDelayMs, RobotsPolicyCache robotsCache) {
        _defaultDelayMs = defaultDelayMs;
        _robotsCache = robotsCache;
    }

    /**
     * Must be called before the limiter is used by more than one thread.
     * 
     * @param robotsCache source of robots.txt crawl delays, or null
     * @return this limiter
     */
    public DomainRateLimiter setRobotsCache(RobotsPolicyCache robotsCache) {
        _robotsCache = robotsCache;
        return this;
    }

    public long getEffectiveDelay(String domain) {
        if (_robotsCache != null) {
            Long crawlDelay = _robotsCache.getCrawlDelay(domain);
            if (crawlDelay != null) {
                return Math.max(_defaultDelayMs, crawlDelay);
            }
        }

        return _defaultDelayMs;
    }

    /**
     * Block until the domain's delay has passed since the last request
     * started, then record "now" as the start of the next request.
     * 
     * @param domain domain about to be fetched
     * @return time spent waiting, in milliseconds
     * @throws InterruptedException if interrupted while waiting
     */
    public long waitIfNeeded(String domain) throws InterruptedException {
        DomainRateState state = getState(domain);
        synchronized (state) {
            long waited = 0;
            long now = currentTimeMillis();
            if (state._lastFetchTime != NEVER_FETCHED) {
                long nextFetchTime = state._lastFetchTime + getEffectiveDelay(domain);
                if (now < nextFetchTime) {
                    waited = nextFetchTime - now;
                    LOGGER.debug("Waiting {}ms before fetching from {}", waited, domain);
                    sleep(waited);
                    now = currentTimeMillis();
                }
            }

            state._lastFetchTime = now;
            return waited;
        }
    }

    /**
     * Hold off on a domain that told us to slow down. The next request's
     * delay is measured from the end of the back-off.
     * 
     * @param domain domain that returned a 429
     * @param backoffMs how long to wait
     * @throws InterruptedException if interrupted while waiting
     */
    public void backOff(String domain, long backoffMs) throws InterruptedException {
        DomainRateState state = getState(domain);
        synchronized (state) {
            LOGGER.debug("Backing off {}ms for {}", backoffMs, domain);
            if (backoffMs > 0) {
                sleep(backoffMs);
            }

            state._lastFetchTime = currentTimeMillis();
        }
    }

    public long getDefaultDelayMs() {
        return _defaultDelayMs;
    }

    private DomainRateState getState(String domain) {
        return _states.computeIfAbsent(domain, d -> new DomainRateState());
    }

    protected long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    protected void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }
}
