package com.lidar.service.impl;

import com.lidar.aspect.Timed;
import com.lidar.config.LidarProperties;
import com.lidar.model.CacheState;
import com.lidar.model.CacheStats;
import com.lidar.model.CachedTile;
import com.lidar.repository.TileCacheRepository;
import com.lidar.service.TileCacheService;
import com.lidar.storage.ContentTypes;
import com.lidar.storage.ObjectStorage;
import com.lidar.storage.OriginFetcher;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Tile cache backed by the source-tile bucket. Concurrent misses for one tile may both
 * download; the completion write is last-writer-wins and a failure only marks the row
 * of its own attempt.
 */
@Service
public class TileCacheServiceImpl implements TileCacheService {

    private static final Logger logger = LoggerFactory.getLogger(TileCacheServiceImpl.class);

    private static final String DEFAULT_EXTENSION = "laz";

    @Autowired
    private TileCacheRepository tileCacheRepository;

    @Autowired
    private ObjectStorage objectStorage;

    @Autowired
    private OriginFetcher originFetcher;

    @Autowired
    private LidarProperties properties;

    @Override
    @Timed(value = "cache.resolve", logLevel = Timed.LogLevel.INFO)
    public Path resolveLocalFile(String sourceLocator, Path workDir) throws IOException {
        String tileName = tileNameFor(sourceLocator);
        String objectKey = tileName + "." + extensionOf(sourceLocator);
        Path localFile = workDir.resolve(objectKey);
        String bucket = properties.getStorage().getSourceTilesBucket();

        Optional<CachedTile> cached = tileCacheRepository.findByName(tileName).filter(CachedTile::isComplete);
        if (cached.isPresent()) {
            CachedTile row = cached.get();
            try {
                objectStorage.getFile(row.getBucket(), row.getObjectKey(), localFile);
                // counted only once the object is actually served
                long accesses = tileCacheRepository.recordHit(tileName)
                        .map(CachedTile::getAccessCount)
                        .orElse(row.getAccessCount());
                logger.info("Cache hit for {} (accesses: {})", tileName, accesses);
                return localFile;
            } catch (FileNotFoundException e) {
                // row outlived its object, e.g. after a bucket purge
                logger.warn("Cached object for {} is gone, downloading again", tileName);
            }
        }

        logger.info("Cache miss for {}, downloading from origin", tileName);
        String attemptId = UUID.randomUUID().toString();
        tileCacheRepository.startDownload(CachedTile.builder()
                .tileName(tileName)
                .sourceUrl(sourceLocator)
                .bucket(bucket)
                .objectKey(objectKey)
                .state(CacheState.DOWNLOADING)
                .attemptId(attemptId)
                .build());

        long size;
        try {
            size = originFetcher.fetch(sourceLocator, localFile, properties.getDownload().getTileTimeout());
            objectStorage.putFile(bucket, objectKey, localFile, ContentTypes.forFileName(objectKey));
        } catch (IOException | RuntimeException e) {
            if (!tileCacheRepository.markFailed(tileName, attemptId)) {
                logger.debug("Cache row for {} no longer owned by attempt {}", tileName, attemptId);
            }
            logger.error("Failed to cache tile {}: {}", tileName, e.getMessage());
            throw e;
        }

        try {
            tileCacheRepository.markComplete(tileName, attemptId, size);
            logger.info("Cached tile {} ({} bytes)", tileName, size);
        } catch (RuntimeException e) {
            // the local copy is good even if the index could not record it
            logger.warn("Could not mark tile {} complete: {}", tileName, e.getMessage());
        }
        return localFile;
    }

    @Override
    public CacheStats stats() {
        List<CachedTile> complete = tileCacheRepository.findAll().stream()
                .filter(CachedTile::isComplete)
                .toList();

        long totalSize = complete.stream()
                .mapToLong(row -> row.getFileSizeBytes() != null ? row.getFileSizeBytes() : 0L)
                .sum();
        long totalAccesses = complete.stream().mapToLong(CachedTile::getAccessCount).sum();

        return CacheStats.builder()
                .totalCachedTiles(complete.size())
                .totalSizeBytes(totalSize)
                .totalAccesses(totalAccesses)
                .savedDownloads(Math.max(0, totalAccesses - complete.size()))
                .build();
    }

    /**
     * Last path segment of the locator without its extension
     */
    public static String tileNameFor(String sourceLocator) {
        String name = lastSegment(sourceLocator);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String extensionOf(String sourceLocator) {
        String name = lastSegment(sourceLocator);
        int dot = name.lastIndexOf('.');
        return dot > 0 && dot < name.length() - 1 ? name.substring(dot + 1) : DEFAULT_EXTENSION;
    }

    private static String lastSegment(String sourceLocator) {
        if (sourceLocator == null || sourceLocator.isBlank()) {
            throw new IllegalArgumentException("Source locator is empty");
        }
        String path = sourceLocator.trim();
        if (path.contains("://") || path.startsWith("file:")) {
            // drop query string and fragment
            String uriPath = URI.create(path).getPath();
            if (uriPath != null && !uriPath.isEmpty()) {
                path = uriPath;
            }
        }
        while (path.endsWith("/") || path.endsWith("\\")) {
            path = path.substring(0, path.length() - 1);
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        String name = slash >= 0 ? path.substring(slash + 1) : path;
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive a tile name from " + sourceLocator);
        }
        return name;
    }
}
