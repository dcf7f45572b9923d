package com.izapolsky.imagedownloader;

/**
 * Result of a write to local storage
 */
public class StoreResult {

    private static final StoreResult OK = new StoreResult(null, null);

    private final String failure;
    private final Throwable cause;

    private StoreResult(String failure, Throwable cause) {
        this.failure = failure;
        this.cause = cause;
    }

    public static StoreResult ok() {
        return OK;
    }

    public static StoreResult failure(String reason, Throwable cause) {
        return new StoreResult(reason, cause);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public String getFailure() {
        return failure;
    }

    public Throwable getCause() {
        return cause;
    }
}
