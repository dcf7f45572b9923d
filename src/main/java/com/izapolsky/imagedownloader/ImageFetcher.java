package com.izapolsky.imagedownloader;

/**
 * Service turning an url into a decoded image
 */
public interface ImageFetcher {

    /**
     * Downloads and decodes the image behind given url. Implementations report problems
     * (network, non-2xx status, undecodable content) through the result instead of throwing.
     *
     * @param url
     * @return
     */
    FetchResult fetch(String url);
}
