package com.scaleunlimited.politecrawler.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;

import com.scaleunlimited.politecrawler.config.CrawlConfig;
import com.scaleunlimited.politecrawler.config.DurationCrawlTerminator;
import com.scaleunlimited.politecrawler.config.ManualCrawlTerminator;
import com.scaleunlimited.politecrawler.output.OutputFormat;

public class CrawlToolOptionsTest {

    @Test
    public void testDefaults() throws Exception {
        CrawlToolOptions options = parse("-url", "http://domain.com");
        CrawlConfig config = options.makeCrawlConfig();

        assertEquals("http://domain.com", config.getSeedUrl());
        assertEquals(CrawlConfig.DEFAULT_MAX_DEPTH, config.getMaxDepth());
        assertEquals(1000L, config.getDefaultCrawlDelayMs());
        assertTrue(config.isRespectRobots());
        assertFalse(config.isAllowExternal());
        assertEquals("*", config.getRobotsAgentName());
        assertEquals(CrawlConfig.DEFAULT_USER_AGENT, config.getUserAgent());
        assertThat(config.getExcludePatterns()).isEmpty();
        assertThat(config.makeTerminator()).isInstanceOf(ManualCrawlTerminator.class);
        assertEquals(CrawlConfig.DEFAULT_MAX_CONTENT_SIZE, config.getMaxContentSize());

        assertEquals(OutputFormat.JSON, options.getFormat());
        assertEquals("output.json", options.getOutputFile());
        assertFalse(options.isVerbose());
    }

    @Test
    public void testAllOptions() throws Exception {
        CrawlToolOptions options = parse("--url", "http://domain.com",
                "--allow-exit",
                "--external-links-depth", "2",
                "--depth", "5",
                "--delay", "2.5",
                "--no-robots",
                "--bot-name", "mybot",
                "-o", "results.csv",
                "--format", "csv",
                "--exclude", "*/login*", "*/admin*",
                "--include", "*/blog/*",
                "-v",
                "--user-agent", "MyCrawler/2.0",
                "--max-duration", "60",
                "--max-queue-size", "500",
                "--max-outlinks", "100",
                "--timeout", "30",
                "--robots-timeout", "3",
                "--max-content-size", "2000000");

        CrawlConfig config = options.makeCrawlConfig();
        assertTrue(config.isAllowExternal());
        assertEquals(2, config.getExternalHopBudget());
        assertEquals(5, config.getMaxDepth());
        assertEquals(2500L, config.getDefaultCrawlDelayMs());
        assertFalse(config.isRespectRobots());
        assertEquals("mybot", config.getRobotsAgentName());
        assertThat(config.getExcludePatterns()).containsExactly("*/login*", "*/admin*");
        assertThat(config.getIncludePatterns()).containsExactly("*/blog/*");
        assertEquals("MyCrawler/2.0", config.getUserAgent());
        assertEquals(500, config.getMaxQueueSize());
        assertEquals(100, config.getMaxOutlinksPerPage());
        assertEquals(30000, config.getFetchTimeoutMs());
        assertEquals(3000, config.getRobotsTimeoutMs());
        assertEquals(2000000, config.getMaxContentSize());
        assertThat(config.makeTerminator()).isInstanceOf(DurationCrawlTerminator.class);

        assertEquals(OutputFormat.CSV, options.getFormat());
        assertEquals("results.csv", options.getOutputFile());
        assertTrue(options.isVerbose());
    }

    @Test
    public void testPrintFormatGoesToConsole() throws Exception {
        CrawlToolOptions options = parse("-url", "http://domain.com", "-format", "print", "-output", "ignored.txt");
        assertEquals(OutputFormat.PRINT, options.getFormat());
        assertNull(options.getOutputFile());
    }

    @Test(expected = CmdLineException.class)
    public void testUrlIsRequired() throws Exception {
        parse("-depth", "2");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExternalDepthNeedsAllowExit() throws Exception {
        parse("-url", "http://domain.com", "-external-links-depth", "2").validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidFormat() throws Exception {
        parse("-url", "http://domain.com", "-format", "xml").validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidMaxContentSize() throws Exception {
        parse("-url", "http://domain.com", "-max-content-size", "0").validate();
    }

    private static CrawlToolOptions parse(String... args) throws CmdLineException {
        CrawlToolOptions options = new CrawlToolOptions();
        new CmdLineParser(options).parseArgument(args);
        return options;
    }
}
