package com.izapolsky.imagedownloader;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;

public class UrlSourceTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testTextFileTrimsAndSkipsBlankLines() throws Exception {
        File input = tmp.newFile("urls.txt");
        FileUtils.writeStringToFile(input, "http://a/1.jpg\n  http://a/2.jpg  \n\n\r\nhttp://a/3.jpg", StandardCharsets.UTF_8);

        assertEquals(Arrays.asList("http://a/1.jpg", "http://a/2.jpg", "http://a/3.jpg"), new TextFileUrlSource(input).read());
    }

    @Test(expected = UncheckedIOException.class)
    public void testTextFileMissing() {
        new TextFileUrlSource(new File(tmp.getRoot(), "missing.txt")).read();
    }

    @Test
    public void testCsvNamedColumn() throws Exception {
        File input = tmp.newFile("urls.csv");
        FileUtils.writeStringToFile(input, "id,image_url,title\n"
                + "1,http://a/1.jpg,first\n"
                + "2,,no image\n"
                + "3,\"http://a/3.jpg\",\"with, comma\"\n", StandardCharsets.UTF_8);

        assertEquals(Arrays.asList("http://a/1.jpg", "http://a/3.jpg"), new CsvUrlSource(input, CsvUrlSource.DEFAULT_COLUMN).read());
    }

    @Test
    public void testCsvOtherColumn() throws Exception {
        File input = tmp.newFile("urls.csv");
        FileUtils.writeStringToFile(input, "thumb,full\nhttp://a/t.jpg,http://a/f.jpg\n", StandardCharsets.UTF_8);

        assertEquals(Arrays.asList("http://a/f.jpg"), new CsvUrlSource(input, "full").read());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCsvMissingColumn() throws Exception {
        File input = tmp.newFile("urls.csv");
        FileUtils.writeStringToFile(input, "id,url\n1,http://a/1.jpg\n", StandardCharsets.UTF_8);

        new CsvUrlSource(input, "image_url").read();
    }
}
