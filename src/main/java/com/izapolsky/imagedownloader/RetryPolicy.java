package com.izapolsky.imagedownloader;

/**
 * Decides how long a task waits before an attempt and when it has to give up
 */
public interface RetryPolicy {

    /**
     * @param attempt number of attempts already made, starting with 0
     * @return delay in milliseconds before the next attempt, 0 for none
     */
    long nextDelayMillis(int attempt);

    /**
     * @param attempt number of attempts already made
     * @return true when no further attempt is allowed
     */
    boolean attemptsExhausted(int attempt);

    /**
     * @return upper bound of {@link #nextDelayMillis(int)}
     */
    long maxDelayMillis();

    int maxAttempts();
}
