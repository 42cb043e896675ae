package com.scaleunlimited.politecrawler.config;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class DurationCrawlTerminatorTest {

    @Test
    public void testTerminatesAfterDuration() throws Exception {
        FakeClockTerminator terminator = new FakeClockTerminator(10);
        terminator.open();
        assertFalse(terminator.isTerminated());

        terminator._now += 9999;
        assertFalse(terminator.isTerminated());

        terminator._now += 1;
        assertTrue(terminator.isTerminated());
    }

    @Test
    public void testCancel() throws Exception {
        FakeClockTerminator terminator = new FakeClockTerminator(1000);
        terminator.open();
        terminator.cancel();
        assertTrue(terminator.isTerminated());

        ManualCrawlTerminator manual = new ManualCrawlTerminator();
        manual.open();
        assertFalse(manual.isTerminated());
        manual.cancel();
        assertTrue(manual.isTerminated());
    }

    private static class FakeClockTerminator extends DurationCrawlTerminator {
        private long _now = 50000L;

        public FakeClockTerminator(int maxDurationSec) {
            super(maxDurationSec);
        }

        @Override
        protected long currentTimeMillis() {
            return _now;
        }
    }
}
