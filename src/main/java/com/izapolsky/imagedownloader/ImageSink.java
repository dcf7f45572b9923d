package com.izapolsky.imagedownloader;

import java.awt.image.BufferedImage;
import java.io.File;

/**
 * Persists decoded images
 */
public interface ImageSink {

    /**
     * Encodes image and writes it to destination, replacing what was there
     *
     * @param image
     * @param destination
     * @return
     */
    StoreResult store(BufferedImage image, File destination);
}
