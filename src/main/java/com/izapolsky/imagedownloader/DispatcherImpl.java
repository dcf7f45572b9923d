package com.izapolsky.imagedownloader;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dispatcher on a fixed thread pool. Each task gets its own deadline, counted from the moment
 * a worker picks it up. A task past its deadline is reported as {@link Outcome#TIMED_OUT} right away
 * and its worker is interrupted.
 */
public class DispatcherImpl implements Dispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(DispatcherImpl.class);

    private final DownloadSettings settings;
    private final RetryPolicy retryPolicy;
    private final ImageFetcher fetcher;
    private final ImageSink sink;
    private final LocalStorage storage;

    public DispatcherImpl(DownloadSettings settings, RetryPolicy retryPolicy, ImageFetcher fetcher, ImageSink sink,
                          LocalStorage storage) {
        this.settings = settings;
        this.retryPolicy = retryPolicy;
        this.fetcher = fetcher;
        this.sink = sink;
        this.storage = storage;
    }

    /**
     * Explicit timeout if configured, otherwise worst case of sleeping before every attempt
     *
     * @return timeout in milliseconds, 0 when tasks are not timed
     */
    public long taskTimeoutMillis() {
        if (settings.getTaskTimeoutMillis() != DownloadSettings.COMPUTED_TIMEOUT) {
            return settings.getTaskTimeoutMillis();
        }
        return retryPolicy.maxDelayMillis() * retryPolicy.maxAttempts();
    }

    @Override
    public RunResult run(List<String> urls) {
        long timeout = taskTimeoutMillis();
        if (timeout > 0) {
            LOG.warn("Setting timeout={} ms per url", timeout);
        } else {
            LOG.info("No timeout per url");
        }

        RunResult result = new RunResult(urls);
        CompletionCounter counter = new CompletionCounter(urls.size());
        BlockingQueue<Pair<String, Outcome>> finished = new LinkedBlockingQueue<>();

        ExecutorService workers = Executors.newFixedThreadPool(settings.getMaxWorkers(),
                new ThreadFactoryBuilder().setNameFormat("worker-%d").build());
        ScheduledExecutorService deadlines = timeout > 0
                ? Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder().setNameFormat("deadline-%d").setDaemon(true).build())
                : null;

        long tik = System.nanoTime();
        try {
            for (String url : urls) {
                DownloadTask task = new DownloadTask(url, DestinationNames.destinationFor(settings.getOutputFolder(), url),
                        retryPolicy, fetcher, sink, storage, counter);
                workers.execute(new TimedTask(task, finished, deadlines, timeout));
            }

            //completion order
            for (int i = 0; i < urls.size(); i++) {
                Pair<String, Outcome> done = finished.take();
                result.record(done.first, done.second);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(String.format("Interrupted with %1$s of %2$s urls finished", result.size(), result.getUrls().size()), e);
        } finally {
            workers.shutdownNow();
            if (deadlines != null) {
                deadlines.shutdownNow();
            }
        }

        result.finish(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - tik), counter.get());
        return result;
    }

    /**
     * Reports exactly one outcome of the wrapped task, either its own or a timeout
     */
    static class TimedTask implements Runnable {

        private final DownloadTask task;
        private final BlockingQueue<Pair<String, Outcome>> finished;
        private final ScheduledExecutorService deadlines;
        private final long timeoutMillis;
        private final FutureTask<Outcome> future;
        private final AtomicBoolean reported = new AtomicBoolean();

        TimedTask(DownloadTask task, BlockingQueue<Pair<String, Outcome>> finished, ScheduledExecutorService deadlines,
                  long timeoutMillis) {
            this.task = task;
            this.finished = finished;
            this.deadlines = deadlines;
            this.timeoutMillis = timeoutMillis;
            this.future = new FutureTask<>(this::execute);
        }

        @Override
        public void run() {
            future.run();
        }

        private Outcome execute() {
            ScheduledFuture<?> deadline = deadlines == null ? null : deadlines.schedule(this::expire, timeoutMillis, TimeUnit.MILLISECONDS);
            Outcome outcome = Outcome.PERMANENTLY_FAILED;
            try {
                outcome = task.call();
            } catch (RuntimeException e) {
                LOG.error("Download of {} failed unexpectedly", task.getUrl(), e);
            } finally {
                if (deadline != null) {
                    deadline.cancel(false);
                }
                report(outcome);
            }
            return outcome;
        }

        private void expire() {
            if (report(Outcome.TIMED_OUT)) {
                LOG.warn("Download of {} timed out after {} ms", task.getUrl(), timeoutMillis);
                future.cancel(true);
            }
        }

        private boolean report(Outcome outcome) {
            if (reported.compareAndSet(false, true)) {
                finished.add(new Pair<>(task.getUrl(), outcome));
                return true;
            }
            return false;
        }
    }
}
