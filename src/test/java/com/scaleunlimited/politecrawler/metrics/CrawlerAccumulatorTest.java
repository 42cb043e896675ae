package com.scaleunlimited.politecrawler.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import com.scaleunlimited.politecrawler.pojos.FetchStatus;

public class CrawlerAccumulatorTest {

    @Test
    public void testCounters() throws Exception {
        CrawlerAccumulator accumulator = new CrawlerAccumulator();
        accumulator.increment(FetchStatus.FETCHED);
        accumulator.increment(FetchStatus.FETCHED);
        accumulator.increment(CrawlerMetrics.COUNTER_LINKS_FOUND, 25);

        assertEquals(2, accumulator.getValue(FetchStatus.FETCHED));
        assertEquals(25, accumulator.getValue(CrawlerMetrics.COUNTER_LINKS_FOUND));
        assertEquals(0, accumulator.getValue(FetchStatus.HTTP_GONE));

        assertThat(accumulator.getCounters()).containsOnlyKeys("FetchStatus->FETCHED",
                "CrawlerMetrics->COUNTER_LINKS_FOUND");
    }
}
