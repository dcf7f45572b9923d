package com.izapolsky.imagedownloader;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Number of finished (downloaded or skipped) urls in one run, shared by all workers.
 * Used for progress output only.
 */
public class CompletionCounter {

    private final AtomicInteger completed = new AtomicInteger(0);
    private final int total;

    public CompletionCounter(int total) {
        this.total = total;
    }

    /**
     * @return value after increment
     */
    public int increment() {
        return completed.incrementAndGet();
    }

    public int get() {
        return completed.get();
    }

    public int getTotal() {
        return total;
    }
}
