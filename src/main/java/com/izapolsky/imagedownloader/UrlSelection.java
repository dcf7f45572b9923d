package com.izapolsky.imagedownloader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Optionally shuffles and caps list of urls before download
 */
public class UrlSelection {

    private final int maxImages;
    private final boolean shuffle;
    private final Random random;

    /**
     * @param maxImages cap, applied only when positive
     * @param shuffle shuffle before capping, used only with a cap
     * @param random
     */
    public UrlSelection(int maxImages, boolean shuffle, Random random) {
        this.maxImages = maxImages;
        this.shuffle = shuffle;
        this.random = random;
    }

    public List<String> select(List<String> urls) {
        if (maxImages <= 0) {
            return urls;
        }
        List<String> selected = new ArrayList<>(urls);
        if (shuffle) {
            Collections.shuffle(selected, random);
        }
        return selected.size() > maxImages ? new ArrayList<>(selected.subList(0, maxImages)) : selected;
    }
}
