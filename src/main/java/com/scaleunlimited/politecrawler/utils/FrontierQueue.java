package com.scaleunlimited.politecrawler.utils;

import java.util.LinkedList;

import com.scaleunlimited.politecrawler.pojos.FrontierEntry;

/**
 * First-in, first-out queue of URLs waiting to be crawled. Entries are
 * added in discovery order, which gives us breadth-first traversal since
 * every entry at depth N is added before any entry at depth N + 1.
 */
public class FrontierQueue {

    private int _maxQueueSize;

    private LinkedList<FrontierEntry> _queue;

    public FrontierQueue() {
        this(Integer.MAX_VALUE);
    }

    public FrontierQueue(int maxQueueSize) {
        _maxQueueSize = maxQueueSize;
    }

    /**
     * Lifecycle management - called before the crawl starts.
     */
    public void open() {
        _queue = new LinkedList<>();
    }

    public boolean isEmpty() {
        return _queue.isEmpty();
    }

    /**
     * Add a new entry to the end of the queue, if there's room.
     * 
     * @param entry entry to be added
     * @return the entry if we're rejecting it, or null if it was added
     */
    public FrontierEntry add(FrontierEntry entry) {
        if (_queue.size() >= _maxQueueSize) {
            return entry;
        }

        _queue.add(entry);
        return null;
    }

    public FrontierEntry poll() {
        return _queue.poll();
    }

    public int size() {
        return _queue.size();
    }

    public int getMaxQueueSize() {
        return _maxQueueSize;
    }
}
