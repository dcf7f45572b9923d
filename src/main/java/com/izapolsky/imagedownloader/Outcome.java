package com.izapolsky.imagedownloader;

/**
 * Terminal state of a single url download
 */
public enum Outcome {
    /**
     * Image fetched and written to the output folder
     */
    SUCCEEDED(true),
    /**
     * Destination file was already present, nothing fetched
     */
    SKIPPED(true),
    /**
     * All attempts used up
     */
    PERMANENTLY_FAILED(false),
    /**
     * Task did not finish before its deadline
     */
    TIMED_OUT(false);

    private final boolean success;

    Outcome(boolean success) {
        this.success = success;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Picks the outcome to keep when the same url was downloaded more than once in a run.
     * Any success wins over a failure, otherwise the first one seen is kept.
     *
     * @param seen
     * @param other
     * @return
     */
    public static Outcome preferred(Outcome seen, Outcome other) {
        if (!seen.isSuccess() && other.isSuccess()) {
            return other;
        }
        return seen;
    }
}
