package com.scaleunlimited.politecrawler.output;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import org.junit.Test;

import com.scaleunlimited.politecrawler.pojos.CrawlResult;

public class CrawlSummaryTest {

    @Test
    public void testSummary() throws Exception {
        Map<String, Long> crawlDelays = new TreeMap<>();
        crawlDelays.put("domain.com", 5000L);

        CrawlSummary summary = new CrawlSummary(ResultWritersTest.makeResults(), 3, true, crawlDelays);
        assertEquals(2, summary.getPagesScraped());
        assertEquals(3, summary.getUrlsVisited());
        assertThat(summary.getDomains()).containsExactly("domain.com");
        assertEquals(2, summary.getTotalLinks());
        assertEquals(1, summary.getTotalImages());

        String output = print(summary);
        assertThat(output).contains("CRAWL SUMMARY");
        assertThat(output).contains("Pages scraped: 2");
        assertThat(output).contains("URLs visited: 3");
        assertThat(output).contains("Domains: domain.com");
        assertThat(output).contains("Robots.txt compliance: Enabled");
        assertThat(output).contains("Custom crawl delays: domain.com=5.0s");
    }

    @Test
    public void testNoCrawlDelays() throws Exception {
        CrawlSummary summary = new CrawlSummary(ResultWritersTest.makeResults(), 2, false,
                Collections.<String, Long> emptyMap());
        String output = print(summary);
        assertThat(output).contains("Robots.txt compliance: Disabled");
        assertThat(output).doesNotContain("Custom crawl delays");
    }

    @Test
    public void testNothingPrintedWithoutResults() throws Exception {
        CrawlSummary summary = new CrawlSummary(Collections.<CrawlResult> emptyList(), 5, true,
                Collections.<String, Long> emptyMap());
        assertEquals("", print(summary));
    }

    private static String print(CrawlSummary summary) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, "UTF-8");
        summary.print(out);
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }
}
