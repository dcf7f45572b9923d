package com.izapolsky.imagedownloader;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Local filesystem implementation
 */
public class LocalStorageImpl implements LocalStorage {

    private static final Logger LOG = LoggerFactory.getLogger(LocalStorageImpl.class);

    @Override
    public boolean exists(File path) {
        return path.exists();
    }

    @Override
    public StoreResult ensureDir(File directory) {
        if (directory.isDirectory()) {
            return StoreResult.ok();
        }
        try {
            //forceMkdir tolerates directory appearing between the check and the creation
            FileUtils.forceMkdir(directory);
            LOG.info("Created output folder at {}", directory);
            return StoreResult.ok();
        } catch (IOException e) {
            return StoreResult.failure(String.format("Failed to create folder %1$s", directory.getAbsolutePath()), e);
        }
    }
}
