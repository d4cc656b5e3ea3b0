package com.lidar.service;

import com.lidar.model.CacheStats;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Content-addressed cache of source tiles in object storage, keyed by the tile name
 * derived from the download locator
 */
public interface TileCacheService {

    /**
     * Return a local copy of the tile in {@code workDir}. A cached tile is copied from object
     * storage; otherwise it is downloaded from its origin and cached for later requests.
     *
     * @throws IOException if neither the cache nor the origin can supply the tile
     */
    Path resolveLocalFile(String sourceLocator, Path workDir) throws IOException;

    CacheStats stats();
}
