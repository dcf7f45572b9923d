package com.izapolsky.imagedownloader;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns outcomes of a run into a summary and a list of failed urls
 */
public class Reporter {

    private static final Logger LOG = LoggerFactory.getLogger(Reporter.class);

    public static final String DEFAULT_FAILED_URLS_FILE = "failed_urls.txt";

    /**
     * @param result
     * @return number of successful urls, failed urls in input order
     */
    public Pair<Integer, List<String>> summarize(RunResult result) {
        int succeeded = 0;
        List<String> failed = new ArrayList<>();
        for (String url : result.getUrls()) {
            Outcome outcome = result.get(url);
            if (outcome != null && outcome.isSuccess()) {
                succeeded++;
            } else {
                failed.add(url);
            }
        }
        return new Pair<>(succeeded, failed);
    }

    /**
     * Writes one url per line, replacing existing file
     *
     * @param urls
     * @param destination
     */
    public void writeFailedUrls(List<String> urls, File destination) {
        try {
            FileUtils.writeLines(destination, StandardCharsets.UTF_8.name(), urls, "\n", false);
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Failed writing to %1$s", destination.getAbsolutePath()), e);
        }
    }

    /**
     * Logs summary, dumps failed urls when there are any
     *
     * @param result
     * @param failedUrlsFile
     * @return summary of the run
     */
    public Pair<Integer, List<String>> report(RunResult result, File failedUrlsFile) {
        Pair<Integer, List<String>> summary = summarize(result);
        if (!summary.second.isEmpty()) {
            writeFailedUrls(summary.second, failedUrlsFile);
            LOG.warn("Failed downloading {} urls. Dumping failed urls at `{}`", summary.second.size(), failedUrlsFile);
        } else {
            LOG.info("Successfully downloaded {} urls in {} secs", summary.first,
                    String.format(Locale.ROOT, "%.2f", result.getElapsedMillis() / 1000.0));
        }
        return summary;
    }
}
