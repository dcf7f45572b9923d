package com.izapolsky.imagedownloader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.concurrent.Callable;

/**
 * All attempts to download one url. Instances are confined to the worker running them.
 */
public class DownloadTask implements Callable<Outcome> {

    private static final Logger LOG = LoggerFactory.getLogger(DownloadTask.class);

    private final String url;
    private final File destination;
    private final RetryPolicy retryPolicy;
    private final ImageFetcher fetcher;
    private final ImageSink sink;
    private final LocalStorage storage;
    private final CompletionCounter counter;

    private int attempt;

    public DownloadTask(String url, File destination, RetryPolicy retryPolicy, ImageFetcher fetcher, ImageSink sink,
                        LocalStorage storage, CompletionCounter counter) {
        this.url = url;
        this.destination = destination;
        this.retryPolicy = retryPolicy;
        this.fetcher = fetcher;
        this.sink = sink;
        this.storage = storage;
        this.counter = counter;
    }

    @Override
    public Outcome call() {
        if (storage.exists(destination)) {
            int completed = counter.increment();
            LOG.warn("[Completed: {}/{}] Image with name: {} already downloaded", completed, counter.getTotal(),
                    destination.getName());
            return Outcome.SKIPPED;
        }

        while (!retryPolicy.attemptsExhausted(attempt)) {
            long delay = retryPolicy.nextDelayMillis(attempt);
            if (delay > 0) {
                LOG.debug("Sleeping for {} ms on attempt {}", delay, attempt);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.info("Interrupted while waiting to download {}, giving up", url);
                    return Outcome.TIMED_OUT;
                }
            }

            attempt++;
            String failure = attemptOnce();
            if (failure == null) {
                int completed = counter.increment();
                LOG.info("[Completed: {}/{}] [attempt: {}/{}] Saved image: {}", completed, counter.getTotal(), attempt,
                        retryPolicy.maxAttempts(), destination.getName());
                return Outcome.SUCCEEDED;
            }
            LOG.info("[attempt: {}/{}] Failed downloading image: {} ({})", attempt, retryPolicy.maxAttempts(),
                    destination.getName(), failure);

            if (Thread.currentThread().isInterrupted()) {
                return Outcome.TIMED_OUT;
            }
        }

        LOG.info("Cannot download image: {} after {} attempts", url, attempt);
        return Outcome.PERMANENTLY_FAILED;
    }

    /**
     * Single fetch and store
     *
     * @return null on success, failure description otherwise
     */
    protected String attemptOnce() {
        try {
            FetchResult fetched = fetcher.fetch(url);
            if (!fetched.isSuccess()) {
                return fetched.getFailure();
            }

            StoreResult dir = storage.ensureDir(destination.getAbsoluteFile().getParentFile());
            if (!dir.isSuccess()) {
                return dir.getFailure();
            }

            StoreResult stored = sink.store(fetched.getImage(), destination);
            return stored.isSuccess() ? null : stored.getFailure();
        } catch (RuntimeException e) {
            LOG.debug("Unexpected error downloading {}", url, e);
            return String.format("Unexpected error: %1$s", e);
        }
    }

    public String getUrl() {
        return url;
    }

    public File getDestination() {
        return destination;
    }

    /**
     * @return number of fetch attempts made so far
     */
    public int getAttempt() {
        return attempt;
    }
}
