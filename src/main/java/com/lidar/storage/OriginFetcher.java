package com.lidar.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Fetches content from its original location to a local file
 */
public interface OriginFetcher {

    /**
     * @param locator http(s) URL, file: URI or local path
     * @return number of bytes written to {@code target}
     */
    long fetch(String locator, Path target, Duration timeout) throws IOException;
}
