package com.izapolsky.imagedownloader;

import org.apache.commons.io.FileUtils;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeUnit;

/**
 * Helpers shared by tests
 */
final class TestImages {

    private TestImages() {
    }

    static BufferedImage tiny() {
        BufferedImage image = new BufferedImage(4, 3, BufferedImage.TYPE_INT_RGB);
        image.setRGB(1, 1, 0xff0000);
        return image;
    }

    /**
     * Sink that only creates an empty destination file
     */
    static ImageSink touchingSink() {
        return (image, destination) -> {
            try {
                FileUtils.touch(destination);
                return StoreResult.ok();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        };
    }

    static DownloadSettings.Builder quickSettings(File outputFolder) {
        return DownloadSettings.builder()
                .outputFolder(outputFolder)
                .sleepTime(0, TimeUnit.MILLISECONDS);
    }
}
