package com.izapolsky.imagedownloader;

import java.util.List;

/**
 * Source of image urls to download
 */
public interface UrlSource {

    /**
     * @return urls in source order
     * @throws java.io.UncheckedIOException when source can't be read
     */
    List<String> read();
}
