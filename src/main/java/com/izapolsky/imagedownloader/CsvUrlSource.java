package com.izapolsky.imagedownloader;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Csv file with header row, urls are taken from one named column
 */
public class CsvUrlSource implements UrlSource {

    public static final String DEFAULT_COLUMN = "image_url";

    private final File file;
    private final String column;

    public CsvUrlSource(File file, String column) {
        this.file = file;
        this.column = column;
    }

    @Override
    public List<String> read() {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreSurroundingSpaces(true)
                .build();

        List<String> urls = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(file, StandardCharsets.UTF_8, format)) {
            if (!parser.getHeaderMap().containsKey(column)) {
                throw new IllegalArgumentException(String.format("Column %1$s not found in %2$s, available columns %3$s",
                        column, file.getAbsolutePath(), parser.getHeaderNames()));
            }
            for (CSVRecord record : parser) {
                if (!record.isSet(column)) {
                    continue;
                }
                String url = record.get(column).trim();
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
