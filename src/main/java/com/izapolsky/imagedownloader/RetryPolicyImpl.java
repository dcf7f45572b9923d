package com.izapolsky.imagedownloader;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Fixed or uniformly randomized delay, fixed number of attempts
 */
public class RetryPolicyImpl implements RetryPolicy {

    private final DownloadSettings settings;
    private final Random random;

    public RetryPolicyImpl(DownloadSettings settings) {
        this(settings, null);
    }

    /**
     * @param settings
     * @param random source for randomized delays, null to use a thread local one
     */
    public RetryPolicyImpl(DownloadSettings settings, Random random) {
        this.settings = settings;
        this.random = random;
    }

    @Override
    public long nextDelayMillis(int attempt) {
        if (!settings.isRandomSleepTime()) {
            return settings.getSleepTimeMillis();
        }
        long min = settings.getMinSleepTimeMillis();
        long max = settings.getMaxSleepTimeMillis();
        if (min == max) {
            return min;
        }
        Random source = random == null ? ThreadLocalRandom.current() : random;
        return source.nextLong(min, max);
    }

    @Override
    public boolean attemptsExhausted(int attempt) {
        return attempt >= settings.getMaxAttempts();
    }

    @Override
    public long maxDelayMillis() {
        return settings.isRandomSleepTime() ? settings.getMaxSleepTimeMillis() : settings.getSleepTimeMillis();
    }

    @Override
    public int maxAttempts() {
        return settings.getMaxAttempts();
    }
}
