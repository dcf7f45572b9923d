package com.izapolsky.imagedownloader;

import java.io.File;

/**
 * Filesystem primitives used by download tasks
 */
public interface LocalStorage {

    boolean exists(File path);

    /**
     * Creates directory with parents. Has to be a no-op when directory is already there,
     * also when another worker created it concurrently.
     *
     * @param directory
     * @return
     */
    StoreResult ensureDir(File directory);
}
