package com.scaleunlimited.politecrawler.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.kohsuke.args4j.CmdLineParser;

import com.scaleunlimited.politecrawler.config.ManualCrawlTerminator;
import com.scaleunlimited.politecrawler.crawler.BfsCrawlerBuilder;
import com.scaleunlimited.politecrawler.fetcher.MockRobotsFetcher;
import com.scaleunlimited.politecrawler.fetcher.MockRobotsFetcher.MockRobotsFetcherBuilder;
import com.scaleunlimited.politecrawler.fetcher.NoopSeedProber;
import com.scaleunlimited.politecrawler.fetcher.SiteGraphFetcher;
import com.scaleunlimited.politecrawler.fetcher.SiteGraphFetcher.SiteGraphFetcherBuilder;

public class CrawlToolTest {

    @Rule
    public TemporaryFolder _folder = new TemporaryFolder();

    @Test
    public void testCrawlToJsonFile() throws Exception {
        File outputFile = new File(_folder.getRoot(), "output.json");
        CrawlToolOptions options = parse("-url", "http://domain.com/", "-delay", "0",
                "-output", outputFile.getAbsolutePath());

        SiteGraphFetcher pages = new SiteGraphFetcher()
                .addPage("http://domain.com/", "/page1")
                .addPage("http://domain.com/page1");

        ByteArrayOutputStream console = new ByteArrayOutputStream();
        int result = CrawlTool.run(options, makeBuilder(options, pages, new MockRobotsFetcher()),
                new PrintStream(console, true, "UTF-8"));
        assertEquals(0, result);

        String json = FileUtils.readFileToString(outputFile, StandardCharsets.UTF_8);
        assertThat(json).contains("\"url\": \"http://domain.com/page1\"");
        assertThat(toString(console)).contains("Results saved to " + outputFile.getAbsolutePath());
    }

    @Test
    public void testPrintFormat() throws Exception {
        CrawlToolOptions options = parse("-url", "http://domain.com/", "-delay", "0", "-format", "print");

        SiteGraphFetcher pages = new SiteGraphFetcher().addPage("http://domain.com/");

        ByteArrayOutputStream console = new ByteArrayOutputStream();
        CrawlTool.run(options, makeBuilder(options, pages, new MockRobotsFetcher()),
                new PrintStream(console, true, "UTF-8"));

        String output = toString(console);
        assertThat(output).contains("CRAWL SUMMARY");
        assertThat(output).contains("URL: http://domain.com/");
    }

    @Test
    public void testAbortedCrawl() throws Exception {
        File outputFile = new File(_folder.getRoot(), "output.json");
        CrawlToolOptions options = parse("-url", "http://domain.com/", "-delay", "0",
                "-output", outputFile.getAbsolutePath());

        SiteGraphFetcher pages = new SiteGraphFetcher().addPage("http://domain.com/");
        MockRobotsFetcher robots = new MockRobotsFetcher()
                .addRobots("http://domain.com/robots.txt", "User-agent: *\nDisallow: /\n");

        ByteArrayOutputStream console = new ByteArrayOutputStream();
        int result = CrawlTool.run(options, makeBuilder(options, pages, robots),
                new PrintStream(console, true, "UTF-8"));
        assertEquals(-1, result);
        assertThat(outputFile).doesNotExist();
    }

    @Test
    public void testNothingScraped() throws Exception {
        File outputFile = new File(_folder.getRoot(), "output.json");
        CrawlToolOptions options = parse("-url", "http://domain.com/", "-delay", "0",
                "-output", outputFile.getAbsolutePath());

        // Seed returns a 404.
        SiteGraphFetcher pages = new SiteGraphFetcher();

        ByteArrayOutputStream console = new ByteArrayOutputStream();
        int result = CrawlTool.run(options, makeBuilder(options, pages, new MockRobotsFetcher()),
                new PrintStream(console, true, "UTF-8"));
        assertEquals(0, result);

        String output = toString(console);
        assertThat(output).contains("No data was scraped");
        assertThat(output).contains("URLs visited: 1");
        assertThat(output).contains("http://domain.com/");
        assertThat(outputFile).doesNotExist();
    }

    private static BfsCrawlerBuilder makeBuilder(CrawlToolOptions options, SiteGraphFetcher pages,
            MockRobotsFetcher robots) {
        return new BfsCrawlerBuilder(options.makeCrawlConfig())
                .setPageFetcherBuilder(new SiteGraphFetcherBuilder(pages))
                .setRobotsFetcherBuilder(new MockRobotsFetcherBuilder(robots))
                .setSeedProber(new NoopSeedProber())
                .setCrawlTerminator(new ManualCrawlTerminator());
    }

    private static CrawlToolOptions parse(String... args) throws Exception {
        CrawlToolOptions options = new CrawlToolOptions();
        new CmdLineParser(options).parseArgument(args);
        return options;
    }

    private static String toString(ByteArrayOutputStream bytes) {
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }
}
