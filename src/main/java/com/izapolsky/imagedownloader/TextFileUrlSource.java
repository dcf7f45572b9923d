package com.izapolsky.imagedownloader;

import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Text file with one url per line, blank lines ignored
 */
public class TextFileUrlSource implements UrlSource {

    private final File file;

    public TextFileUrlSource(File file) {
        this.file = file;
    }

    @Override
    public List<String> read() {
        List<String> urls = new ArrayList<>();
        try {
            for (String line : FileUtils.readLines(file, StandardCharsets.UTF_8)) {
                String url = line.trim();
                if (!url.isEmpty()) {
                    urls.add(url);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Failed to read %1$s", file.getAbsolutePath()), e);
        }
        return urls;
    }
}
