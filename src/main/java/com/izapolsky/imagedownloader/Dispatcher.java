package com.izapolsky.imagedownloader;

import java.util.List;

/**
 * Runs downloads of a list of urls on a bounded pool of workers
 */
public interface Dispatcher {

    /**
     * Downloads every url of the list, blocks until each one has an outcome
     * (finished or timed out).
     *
     * @param urls urls to download, duplicates allowed
     * @return outcome per distinct url
     */
    RunResult run(List<String> urls);
}
