package com.scaleunlimited.politecrawler.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DurationCrawlTerminator extends CrawlTerminator {
    private static Logger LOGGER = LoggerFactory.getLogger(DurationCrawlTerminator.class);

    private int _maxDurationSec;

    private long _crawlEndTime;

    public DurationCrawlTerminator(int maxDurationSec) {
        _maxDurationSec = maxDurationSec;
    }

    @Override
    public void open() {
        super.open();

        _crawlEndTime = currentTimeMillis() + (_maxDurationSec * 1000L);
    }

    @Override
    public boolean isTerminated() {
        if (isCancelled()) {
            return true;
        }

        long curTime = currentTimeMillis();
        boolean terminate = curTime >= _crawlEndTime;

        if (terminate) {
            LOGGER.info("Terminating due to current time ({}) later than termination time ({})",
                    curTime, _crawlEndTime);
        }

        return terminate;
    }

    public int getMaxDurationSec() {
        return _maxDurationSec;
    }

    protected long currentTimeMillis() {
        return System.currentTimeMillis();
    }
}
