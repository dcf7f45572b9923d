package com.izapolsky.imagedownloader;

import ch.qos.logback.classic.Level;
import com.beust.jcommander.IValueValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the image downloader
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIGURATION_ERROR = 2;

    public static class ReadableFileValidator implements IValueValidator<File> {
        @Override
        public void validate(String name, File value) throws ParameterException {
            if (!value.isFile() || !value.canRead()) {
                throw new ParameterException(String.format("Parameter %1$s (%2$s) has to be readable file", name, value.getAbsolutePath()));
            }
        }
    }

    public static class AtLeastOneValidator implements IValueValidator<Integer> {
        @Override
        public void validate(String name, Integer value) throws ParameterException {
            if (value < 1) {
                throw new ParameterException(String.format("Parameter %1$s has to be at least 1 (found %2$s)", name, value));
            }
        }
    }

    public static class NotNegativeValidator implements IValueValidator<Integer> {
        @Override
        public void validate(String name, Integer value) throws ParameterException {
            if (value != null && value < 0) {
                throw new ParameterException(String.format("Parameter %1$s can't be negative (found %2$s)", name, value));
            }
        }
    }

    public static class Args {
        @Parameter(names = {"-v", "--debug"}, description = "Log debug information")
        public boolean debug;

        @Parameter(names = {"-h", "--help"}, help = true, description = "Displays help")
        public boolean showHelp;

        @Parameter(names = "--input-text-file", description = "Text file containing one url on each line", validateValueWith = ReadableFileValidator.class)
        public File inputTextFile;

        @Parameter(names = "--input-csv-file", description = "Csv file with a header row and a column of urls", validateValueWith = ReadableFileValidator.class)
        public File inputCsvFile;

        @Parameter(names = "--column-name", description = "Column containing image urls, used only with --input-csv-file")
        public String columnName = CsvUrlSource.DEFAULT_COLUMN;

        @Parameter(names = {"-o", "--output-folder"}, description = "Folder images are saved to, created when missing")
        public File outputFolder = new File(DownloadSettings.DEFAULT_OUTPUT_FOLDER);

        @Parameter(names = "--max-workers", description = "Maximum number of concurrent downloads", validateValueWith = AtLeastOneValidator.class)
        public int maxWorkers = DownloadSettings.DEFAULT_MAX_WORKERS;

        @Parameter(names = "--max-images", description = "Number of images to download, all when not positive")
        public int maxImages = -1;

        @Parameter(names = "--shuffle-urls", description = "Shuffle urls before picking --max-images of them")
        public boolean shuffleUrls;

        @Parameter(names = "--sleep-time", description = "Seconds to wait before each attempt", validateValueWith = NotNegativeValidator.class)
        public int sleepTime = (int) TimeUnit.MILLISECONDS.toSeconds(DownloadSettings.DEFAULT_SLEEP_TIME);

        @Parameter(names = "--min-sleep-time", description = "Minimum seconds to wait before each attempt, used with --random-sleep-time", validateValueWith = NotNegativeValidator.class)
        public int minSleepTime = (int) TimeUnit.MILLISECONDS.toSeconds(DownloadSettings.DEFAULT_MIN_SLEEP_TIME);

        @Parameter(names = "--max-sleep-time", description = "Maximum seconds to wait before each attempt, used with --random-sleep-time", validateValueWith = NotNegativeValidator.class)
        public int maxSleepTime = (int) TimeUnit.MILLISECONDS.toSeconds(DownloadSettings.DEFAULT_MAX_SLEEP_TIME);

        @Parameter(names = "--random-sleep-time", description = "Wait a random time between --min-sleep-time and --max-sleep-time instead of --sleep-time")
        public boolean randomSleepTime;

        @Parameter(names = "--max-attempts", description = "Attempts per url before it is marked as failed", validateValueWith = NotNegativeValidator.class)
        public int maxAttempts = DownloadSettings.DEFAULT_MAX_ATTEMPTS;

        @Parameter(names = "--task-timeout", description = "Seconds a single url may take, derived from sleep time and attempts when not set", validateValueWith = NotNegativeValidator.class)
        public Integer taskTimeout;

        @Parameter(names = "--http-timeout", description = "Connect and read timeout of http requests in seconds", validateValueWith = AtLeastOneValidator.class)
        public int httpTimeout = 30;

        @Parameter(names = "--failed-urls-file", description = "File failed urls are dumped to")
        public File failedUrlsFile = new File(Reporter.DEFAULT_FAILED_URLS_FILE);

        /**
         * Checks constraints spanning several parameters
         */
        public void validate() {
            if (inputTextFile == null && inputCsvFile == null) {
                throw new ParameterException("No text file or csv file given, use --input-text-file or --input-csv-file");
            }
            if (inputTextFile != null && inputCsvFile != null) {
                throw new ParameterException("Only one of --input-text-file and --input-csv-file can be given");
            }
        }

        public UrlSource toUrlSource() {
            return inputTextFile != null ? new TextFileUrlSource(inputTextFile) : new CsvUrlSource(inputCsvFile, columnName);
        }

        public DownloadSettings toSettings() {
            DownloadSettings.Builder builder = DownloadSettings.builder()
                    .maxWorkers(maxWorkers)
                    .maxAttempts(maxAttempts)
                    .sleepTime(sleepTime, TimeUnit.SECONDS)
                    .minSleepTime(minSleepTime, TimeUnit.SECONDS)
                    .maxSleepTime(maxSleepTime, TimeUnit.SECONDS)
                    .randomSleepTime(randomSleepTime)
                    .outputFolder(outputFolder);
            if (taskTimeout != null) {
                builder.taskTimeout(taskTimeout, TimeUnit.SECONDS);
            }
            return builder.build();
        }
    }

    public static void main(String... args) {
        System.exit(run(args));
    }

    /**
     * Parses arguments and runs downloads
     *
     * @param args
     * @return process exit status
     */
    public static int run(String... args) {
        Args parsedCmdLine = new Args();
        JCommander jc = JCommander.newBuilder().addObject(parsedCmdLine).build();
        jc.setProgramName("image-downloader");
        try {
            jc.parse(args);
            if (parsedCmdLine.showHelp) {
                jc.usage();
                return EXIT_OK;
            }
            parsedCmdLine.validate();
            new Main(parsedCmdLine);
            return EXIT_OK;
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            jc.usage();
            return EXIT_CONFIGURATION_ERROR;
        } catch (RuntimeException e) {
            LOG.error("Download run failed", e);
            return EXIT_FAILURE;
        }
    }

    public Main(Args parsedArgs) {
        execute(parsedArgs);
    }

    protected void execute(Args parsedArgs) {
        configureLogging(parsedArgs.debug);

        List<String> urls;
        DownloadSettings settings;
        try {
            urls = new UrlSelection(parsedArgs.maxImages, parsedArgs.shuffleUrls, new Random())
                    .select(parsedArgs.toUrlSource().read());
            settings = parsedArgs.toSettings();
        } catch (UncheckedIOException | IllegalArgumentException e) {
            throw new ParameterException(e.getMessage(), e);
        }

        LOG.warn("Downloading {} urls", urls.size());
        LOG.debug("Using {}", settings);

        int httpTimeoutMillis = (int) TimeUnit.SECONDS.toMillis(parsedArgs.httpTimeout);
        try (ImageFetcherImpl fetcher = ImageFetcherImpl.forWorkers(settings.getMaxWorkers(), httpTimeoutMillis)) {
            Dispatcher dispatcher = new DispatcherImpl(settings, new RetryPolicyImpl(settings), fetcher,
                    new ImageSinkImpl(), new LocalStorageImpl());
            RunResult result = dispatcher.run(urls);
            new Reporter().report(result, parsedArgs.failedUrlsFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close http client", e);
        }
    }

    private static void configureLogging(boolean debug) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(debug ? Level.DEBUG : Level.INFO);
        }
        LOG.debug("Logging debug messages");
    }
}
