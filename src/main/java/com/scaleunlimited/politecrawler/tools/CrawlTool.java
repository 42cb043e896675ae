package com.scaleunlimited.politecrawler.tools;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.politecrawler.config.CrawlConfig;
import com.scaleunlimited.politecrawler.crawler.BfsCrawler;
import com.scaleunlimited.politecrawler.crawler.BfsCrawlerBuilder;
import com.scaleunlimited.politecrawler.crawler.CrawlState;
import com.scaleunlimited.politecrawler.output.CrawlSummary;
import com.scaleunlimited.politecrawler.output.OutputFormat;
import com.scaleunlimited.politecrawler.output.ResultSaver;
import com.scaleunlimited.politecrawler.pojos.CrawlResult;
import com.scaleunlimited.politecrawler.utils.CrawlToolUtils;

public class CrawlTool {
    private static final Logger LOGGER = LoggerFactory.getLogger(CrawlTool.class);

    private static final String BASE_PACKAGE = "com.scaleunlimited.politecrawler";

    // How long the shutdown hook waits for partial results to be saved.
    private static final long SHUTDOWN_SAVE_TIMEOUT_MS = 60 * 1000L;

    private static final int MAX_DIAGNOSTIC_URLS = 5;

    private static void printUsageAndExit(CmdLineParser parser) {
        parser.printUsage(System.err);
        System.exit(-1);
    }

    public static void main(String[] args) {
        CrawlToolOptions options = new CrawlToolOptions();
        CmdLineParser parser = new CmdLineParser(options);

        try {
            parser.parseArgument(args);
            options.validate();
        } catch (CmdLineException e) {
            System.err.println(e.getMessage());
            printUsageAndExit(parser);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsageAndExit(parser);
        }

        if (options.isVerbose()) {
            LogManager.getLogger(BASE_PACKAGE).setLevel(Level.DEBUG);
        }

        try {
            CrawlConfig config = options.makeCrawlConfig();
            if (run(options, new BfsCrawlerBuilder(config), System.out) != 0) {
                System.exit(-1);
            }
        } catch (Throwable t) {
            System.err.println("Error running CrawlTool: " + t.getMessage());
            t.printStackTrace(System.err);
            System.exit(-1);
        }
    }

    /**
     * Crawl using the crawler from <builder>, then save results and print the summary.
     * 
     * @return 0 if the crawl ran, or -1 if it was aborted before fetching anything
     */
    public static int run(CrawlToolOptions options, BfsCrawlerBuilder builder, PrintStream console)
            throws Exception {
        final BfsCrawler crawler = builder.build();
        final CountDownLatch finished = new CountDownLatch(1);

        // On Ctrl-C, stop the crawl loop and give us a chance to save what we've got.
        Thread shutdownHook = new Thread(new Runnable() {

            @Override
            public void run() {
                crawler.getTerminator().cancel();
                try {
                    finished.await(SHUTDOWN_SAVE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }, "crawl-shutdown");

        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            CrawlState state = crawler.crawl();
            if (state == CrawlState.ABORTED) {
                return -1;
            }

            List<CrawlResult> results = crawler.getResults();
            CrawlSummary summary = new CrawlSummary(crawler);

            if (state == CrawlState.CANCELLED) {
                savePartialResults(options, results, console);
                summary.print(console);
                return 0;
            }

            if (options.isVerbose() || (options.getFormat() == OutputFormat.PRINT)) {
                summary.print(console);
            }

            ResultSaver saver = new ResultSaver(options.getFormat(), options.getOutputFile(), console);
            if (saver.save(results)) {
                if (saver.getOutputFile() != null) {
                    console.println(String.format("Results saved to %s", saver.getOutputFile()));
                }
            } else {
                printDiagnostics(crawler, console);
            }

            return 0;
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }
    }

    private static void savePartialResults(CrawlToolOptions options, List<CrawlResult> results,
            PrintStream console) throws Exception {
        console.println("\nCrawling interrupted");
        console.println(String.format("Partial results: %d pages scraped", results.size()));

        ResultSaver saver;
        if (options.getOutputFile() != null) {
            saver = new ResultSaver(options.getFormat(), options.getOutputFile(), console);
        } else {
            String filename = CrawlToolUtils.makePartialResultsFilename(System.currentTimeMillis());
            saver = new ResultSaver(OutputFormat.JSON, filename, console);
        }

        if (saver.save(results)) {
            console.println(String.format("Partial results saved to %s", saver.getOutputFile()));
        }
    }

    private static void printDiagnostics(BfsCrawler crawler, PrintStream console) {
        console.println("No data was scraped. Debug info:");
        console.println(String.format("  URLs visited: %d", crawler.getVisitedCount()));

        String seedUrl = crawler.getSession().getSeedUrl();
        console.println(String.format("  Start URL allowed by robots.txt: %s",
                crawler.getSession().getRobotsCache().canFetch(seedUrl)));

        int shown = 0;
        for (String url : crawler.getSession().getVisitedUrls()) {
            if (shown++ >= MAX_DIAGNOSTIC_URLS) {
                break;
            }

            console.println("    " + url);
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOGGER.debug("JVM is shutting down, leaving shutdown hook in place");
        }
    }
}
