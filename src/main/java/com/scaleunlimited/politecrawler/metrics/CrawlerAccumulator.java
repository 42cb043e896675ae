package com.scaleunlimited.politecrawler.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe set of named counters for one crawl session. Counters are keyed
 * by enum, and reported as "<enum class>-><enum value>".
 */
public class CrawlerAccumulator {

    private static final String DELIMITER = "->";

    private final Map<Enum<?>, AtomicLong> _counters = new ConcurrentHashMap<>();

    /**
     * Increment the counter for the enum e by 1
     * 
     * @param e
     *            The enum to use as a name
     */
    public void increment(Enum<?> e) {
        increment(e, 1);
    }

    /**
     * Modify the counter for the enum e by changeBy
     * 
     * @param e
     *            The enum to use as a name
     * @param changeBy
     *            the value to modify the counter by
     */
    public void increment(Enum<?> e, long changeBy) {
        AtomicLong counter = _counters.computeIfAbsent(e, k -> new AtomicLong());
        counter.addAndGet(changeBy);
    }

    public long getValue(Enum<?> e) {
        AtomicLong counter = _counters.get(e);
        return (counter == null) ? 0L : counter.get();
    }

    /**
     * @return snapshot of all non-zero counters, sorted by name
     */
    public Map<String, Long> getCounters() {
        Map<String, Long> result = new TreeMap<>();
        for (Map.Entry<Enum<?>, AtomicLong> entry : _counters.entrySet()) {
            long value = entry.getValue().get();
            if (value != 0) {
                result.put(makeCounterName(entry.getKey()), value);
            }
        }

        return result;
    }

    public static String makeCounterName(Enum<?> e) {
        return e.getDeclaringClass().getSimpleName() + DELIMITER + e.name();
    }
}
