package com.scaleunlimited.politecrawler.robots;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import org.junit.Test;

import com.scaleunlimited.politecrawler.fetcher.MockRobotsFetcher;
import com.scaleunlimited.politecrawler.metrics.CrawlerAccumulator;
import com.scaleunlimited.politecrawler.metrics.CrawlerMetrics;

public class RobotsPolicyCacheTest {

    private static final String ROBOTS_URL = "http://domain.com/robots.txt";

    @Test
    public void testDisallowAndCrawlDelay() throws Exception {
        MockRobotsFetcher fetcher = new MockRobotsFetcher()
                .addRobots(ROBOTS_URL, "User-agent: *\nDisallow: /private\nCrawl-delay: 5\n");
        CrawlerAccumulator accumulator = new CrawlerAccumulator();
        RobotsPolicyCache cache = new RobotsPolicyCache(fetcher, "http", "*", true, accumulator);

        // Nothing loaded yet, and asking for the delay doesn't trigger a fetch.
        assertNull(cache.getCrawlDelay("domain.com"));
        assertEquals(0, fetcher.getFetchCount(ROBOTS_URL));

        assertTrue(cache.canFetch("http://domain.com/public/page.html"));
        assertFalse(cache.canFetch("http://domain.com/private/page.html"));
        assertEquals(Long.valueOf(5000L), cache.getCrawlDelay("domain.com"));
        assertThat(cache.getCrawlDelays()).containsEntry("domain.com", 5000L);

        assertEquals(1, fetcher.getFetchCount(ROBOTS_URL));
        assertEquals(1, accumulator.getValue(CrawlerMetrics.COUNTER_ROBOTS_FETCHED));
    }

    @Test
    public void testLongCrawlDelayKeepsRules() throws Exception {
        MockRobotsFetcher fetcher = new MockRobotsFetcher()
                .addRobots(ROBOTS_URL, "User-agent: *\nDisallow: /private\nCrawl-delay: 600\n");
        RobotsPolicyCache cache = new RobotsPolicyCache(fetcher, "http", "*", true, new CrawlerAccumulator());

        assertTrue(cache.canFetch("http://domain.com/public"));
        assertFalse(cache.canFetch("http://domain.com/private/page.html"));
        assertEquals(Long.valueOf(600 * 1000L), cache.getCrawlDelay("domain.com"));
        assertFalse(cache.policyFor("domain.com").isAllowAll());
    }

    @Test
    public void testAgentSpecificRules() throws Exception {
        MockRobotsFetcher fetcher = new MockRobotsFetcher()
                .addRobots(ROBOTS_URL, "User-agent: mybot\nDisallow: /\n\nUser-agent: *\nDisallow:\n");

        RobotsPolicyCache anyAgent = new RobotsPolicyCache(fetcher, "http", "*", true, new CrawlerAccumulator());
        assertTrue(anyAgent.canFetch("http://domain.com/page.html"));

        RobotsPolicyCache myBot = new RobotsPolicyCache(fetcher, "http", "mybot", true, new CrawlerAccumulator());
        assertFalse(myBot.canFetch("http://domain.com/page.html"));
    }

    @Test
    public void testMissingRobotsAllowsAll() throws Exception {
        MockRobotsFetcher fetcher = new MockRobotsFetcher();
        CrawlerAccumulator accumulator = new CrawlerAccumulator();
        RobotsPolicyCache cache = new RobotsPolicyCache(fetcher, "http", "*", true, accumulator);

        assertTrue(cache.canFetch("http://domain.com/anything"));
        assertTrue(cache.canFetch("http://domain.com/something/else"));
        assertTrue(cache.policyFor("domain.com").isAllowAll());
        assertNull(cache.getCrawlDelay("domain.com"));

        assertEquals(1, fetcher.getFetchCount(ROBOTS_URL));
        assertEquals(1, accumulator.getValue(CrawlerMetrics.COUNTER_ROBOTS_MISSING));
    }

    @Test
    public void testFailedFetchAllowsAll() throws Exception {
        MockRobotsFetcher fetcher = new MockRobotsFetcher()
                .setStatus(ROBOTS_URL, MockRobotsFetcher.THROW_IO_EXCEPTION)
                .setStatus("http://other.com/robots.txt", 500);
        CrawlerAccumulator accumulator = new CrawlerAccumulator();
        RobotsPolicyCache cache = new RobotsPolicyCache(fetcher, "http", "*", true, accumulator);

        assertTrue(cache.canFetch("http://domain.com/page"));
        assertTrue(cache.canFetch("http://other.com/page"));
        assertEquals(2, accumulator.getValue(CrawlerMetrics.COUNTER_ROBOTS_FAILED));

        // Failures are cached too.
        assertTrue(cache.canFetch("http://domain.com/page2"));
        assertEquals(1, fetcher.getFetchCount(ROBOTS_URL));
    }

    @Test
    public void testRobotsIgnored() throws Exception {
        MockRobotsFetcher fetcher = new MockRobotsFetcher()
                .addRobots(ROBOTS_URL, "User-agent: *\nDisallow: /\n");
        RobotsPolicyCache cache = new RobotsPolicyCache(fetcher, "http", "*", false, new CrawlerAccumulator());

        assertTrue(cache.canFetch("http://domain.com/page.html"));
        assertEquals(0, fetcher.getFetchCount(ROBOTS_URL));
        assertFalse(cache.isRespectRobots());
    }

    @Test
    public void testSchemeAndPort() throws Exception {
        MockRobotsFetcher fetcher = new MockRobotsFetcher()
                .addRobots("https://domain.com:8443/robots.txt", "User-agent: *\nDisallow: /\n");
        RobotsPolicyCache cache = new RobotsPolicyCache(fetcher, "https", "*", true, new CrawlerAccumulator());

        assertFalse(cache.canFetch("https://domain.com:8443/page.html"));
        assertEquals(1, fetcher.getFetchCount("https://domain.com:8443/robots.txt"));
    }

    @Test
    public void testConcurrentLookupsFetchOnce() throws Exception {
        final MockRobotsFetcher fetcher = new MockRobotsFetcher()
                .addRobots(ROBOTS_URL, "User-agent: *\nDisallow: /private\n");
        final RobotsPolicyCache cache = new RobotsPolicyCache(fetcher, "http", "*", true, new CrawlerAccumulator());

        final CountDownLatch start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            Thread t = new Thread(new Runnable() {

                @Override
                public void run() {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        return;
                    }

                    cache.canFetch("http://domain.com/page.html");
                }
            });
            t.start();
            threads.add(t);
        }

        start.countDown();
        for (Thread t : threads) {
            t.join();
        }

        assertEquals(1, fetcher.getFetchCount(ROBOTS_URL));
        assertEquals(1, cache.getNumCachedPolicies());
    }
}
