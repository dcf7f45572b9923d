package com.izapolsky.imagedownloader;

import java.io.File;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Immutable settings of a download run. Durations are kept in milliseconds.
 */
public class DownloadSettings {

    public static final int DEFAULT_MAX_WORKERS = 1;
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_SLEEP_TIME = TimeUnit.SECONDS.toMillis(1);
    public static final long DEFAULT_MIN_SLEEP_TIME = 0;
    public static final long DEFAULT_MAX_SLEEP_TIME = TimeUnit.SECONDS.toMillis(5);
    public static final String DEFAULT_OUTPUT_FOLDER = "images";

    /**
     * Marks that task timeout has to be derived from sleep times and attempts
     */
    public static final long COMPUTED_TIMEOUT = -1;

    private final int maxWorkers;
    private final int maxAttempts;
    private final long sleepTimeMillis;
    private final long minSleepTimeMillis;
    private final long maxSleepTimeMillis;
    private final boolean randomSleepTime;
    private final File outputFolder;
    private final long taskTimeoutMillis;

    private DownloadSettings(Builder builder) {
        this.maxWorkers = builder.maxWorkers;
        this.maxAttempts = builder.maxAttempts;
        this.sleepTimeMillis = builder.sleepTimeMillis;
        this.minSleepTimeMillis = builder.minSleepTimeMillis;
        this.maxSleepTimeMillis = builder.maxSleepTimeMillis;
        this.randomSleepTime = builder.randomSleepTime;
        this.outputFolder = builder.outputFolder;
        this.taskTimeoutMillis = builder.taskTimeoutMillis;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getSleepTimeMillis() {
        return sleepTimeMillis;
    }

    public long getMinSleepTimeMillis() {
        return minSleepTimeMillis;
    }

    public long getMaxSleepTimeMillis() {
        return maxSleepTimeMillis;
    }

    public boolean isRandomSleepTime() {
        return randomSleepTime;
    }

    public File getOutputFolder() {
        return outputFolder;
    }

    /**
     * @return explicit task timeout or {@link #COMPUTED_TIMEOUT}
     */
    public long getTaskTimeoutMillis() {
        return taskTimeoutMillis;
    }

    @Override
    public String toString() {
        return String.format("DownloadSettings[maxWorkers=%1$s, maxAttempts=%2$s, sleepTime=%3$sms, minSleepTime=%4$sms, "
                        + "maxSleepTime=%5$sms, randomSleepTime=%6$s, outputFolder=%7$s, taskTimeout=%8$s]",
                maxWorkers, maxAttempts, sleepTimeMillis, minSleepTimeMillis, maxSleepTimeMillis, randomSleepTime,
                outputFolder, taskTimeoutMillis == COMPUTED_TIMEOUT ? "computed" : taskTimeoutMillis + "ms");
    }

    public static class Builder {
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long sleepTimeMillis = DEFAULT_SLEEP_TIME;
        private long minSleepTimeMillis = DEFAULT_MIN_SLEEP_TIME;
        private long maxSleepTimeMillis = DEFAULT_MAX_SLEEP_TIME;
        private boolean randomSleepTime;
        private File outputFolder = new File(DEFAULT_OUTPUT_FOLDER);
        private long taskTimeoutMillis = COMPUTED_TIMEOUT;

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder sleepTime(long amount, TimeUnit unit) {
            this.sleepTimeMillis = unit.toMillis(amount);
            return this;
        }

        public Builder minSleepTime(long amount, TimeUnit unit) {
            this.minSleepTimeMillis = unit.toMillis(amount);
            return this;
        }

        public Builder maxSleepTime(long amount, TimeUnit unit) {
            this.maxSleepTimeMillis = unit.toMillis(amount);
            return this;
        }

        public Builder randomSleepTime(boolean randomSleepTime) {
            this.randomSleepTime = randomSleepTime;
            return this;
        }

        public Builder outputFolder(File outputFolder) {
            this.outputFolder = outputFolder;
            return this;
        }

        public Builder taskTimeout(long amount, TimeUnit unit) {
            this.taskTimeoutMillis = unit.toMillis(amount);
            return this;
        }

        public DownloadSettings build() {
            checkArgument(maxWorkers >= 1, "maxWorkers has to be at least 1, got %s", maxWorkers);
            checkArgument(maxAttempts >= 0, "maxAttempts can't be negative, got %s", maxAttempts);
            checkArgument(sleepTimeMillis >= 0, "sleepTime can't be negative, got %s", sleepTimeMillis);
            checkArgument(minSleepTimeMillis >= 0, "minSleepTime can't be negative, got %s", minSleepTimeMillis);
            checkArgument(!randomSleepTime || minSleepTimeMillis <= maxSleepTimeMillis,
                    "minSleepTime (%s) can't be greater than maxSleepTime (%s)", minSleepTimeMillis, maxSleepTimeMillis);
            checkArgument(taskTimeoutMillis == COMPUTED_TIMEOUT || taskTimeoutMillis >= 0,
                    "taskTimeout can't be negative, got %s", taskTimeoutMillis);
            checkNotNull(outputFolder, "outputFolder");
            return new DownloadSettings(this);
        }
    }
}
