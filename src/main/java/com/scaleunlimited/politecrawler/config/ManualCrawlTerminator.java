package com.scaleunlimited.politecrawler.config;

/**
 * Only terminates when cancelled.
 */
public class ManualCrawlTerminator extends CrawlTerminator {

    @Override
    public boolean isTerminated() {
        return isCancelled();
    }

}
