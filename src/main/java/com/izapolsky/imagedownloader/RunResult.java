package com.izapolsky.imagedownloader;

import com.google.common.collect.ImmutableList;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Outcome of every distinct url of one run
 */
public class RunResult {

    private final List<String> urls;
    private final ConcurrentMap<String, Outcome> outcomes = new ConcurrentHashMap<>();
    private volatile long elapsedMillis;
    private volatile int completedCount;

    public RunResult(List<String> inputUrls) {
        this.urls = ImmutableList.copyOf(new LinkedHashSet<>(inputUrls));
    }

    /**
     * Records outcome of a task. When url was already recorded, {@link Outcome#preferred(Outcome, Outcome)} decides.
     *
     * @param url
     * @param outcome
     */
    void record(String url, Outcome outcome) {
        outcomes.merge(url, outcome, Outcome::preferred);
    }

    void finish(long elapsedMillis, int completedCount) {
        this.elapsedMillis = elapsedMillis;
        this.completedCount = completedCount;
    }

    /**
     * @return distinct input urls, in order of first appearance
     */
    public List<String> getUrls() {
        return urls;
    }

    public Outcome get(String url) {
        return outcomes.get(url);
    }

    public Map<String, Outcome> getOutcomes() {
        return Collections.unmodifiableMap(outcomes);
    }

    public int size() {
        return outcomes.size();
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    /**
     * @return final value of the run's completion counter, duplicates included
     */
    public int getCompletedCount() {
        return completedCount;
    }
}
