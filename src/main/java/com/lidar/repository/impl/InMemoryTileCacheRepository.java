package com.lidar.repository.impl;

import com.lidar.model.CacheState;
import com.lidar.model.CachedTile;
import com.lidar.repository.TileCacheRepository;

import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tile cache index in a concurrent map. Rows are replaced, never mutated in place,
 * so readers always see a consistent snapshot.
 */
@Repository
public class InMemoryTileCacheRepository implements TileCacheRepository {

    private final Map<String, CachedTile> rows = new ConcurrentHashMap<>();

    @Override
    public Optional<CachedTile> findByName(String tileName) {
        return Optional.ofNullable(rows.get(tileName));
    }

    @Override
    public Optional<CachedTile> recordHit(String tileName) {
        CachedTile updated = rows.computeIfPresent(tileName, (name, row) -> {
            if (!row.isComplete()) {
                return row;
            }
            return row.toBuilder()
                    .lastAccessed(Instant.now())
                    .accessCount(row.getAccessCount() + 1)
                    .build();
        });
        return Optional.ofNullable(updated).filter(CachedTile::isComplete);
    }

    @Override
    public CachedTile startDownload(CachedTile downloading) {
        return rows.compute(downloading.getTileName(), (name, existing) -> {
            CachedTile.CachedTileBuilder row = downloading.toBuilder()
                    .state(CacheState.DOWNLOADING)
                    .lastAccessed(Instant.now());
            if (existing != null) {
                row.accessCount(existing.getAccessCount());
            }
            return row.build();
        });
    }

    @Override
    public CachedTile markComplete(String tileName, String attemptId, long fileSizeBytes) {
        return rows.compute(tileName, (name, existing) -> {
            CachedTile.CachedTileBuilder row = existing != null
                    ? existing.toBuilder()
                    : CachedTile.builder().tileName(tileName);
            // the downloader itself counts as the first touch
            long accesses = existing != null && existing.isComplete()
                    ? existing.getAccessCount()
                    : Math.max(1, existing != null ? existing.getAccessCount() : 0);
            return row.state(CacheState.COMPLETE)
                    .attemptId(attemptId)
                    .fileSizeBytes(fileSizeBytes)
                    .downloadDate(Instant.now())
                    .lastAccessed(Instant.now())
                    .accessCount(accesses)
                    .build();
        });
    }

    @Override
    public boolean markFailed(String tileName, String attemptId) {
        boolean[] updated = {false};
        rows.computeIfPresent(tileName, (name, row) -> {
            if (row.getState() != CacheState.DOWNLOADING || !attemptId.equals(row.getAttemptId())) {
                return row;
            }
            updated[0] = true;
            return row.toBuilder().state(CacheState.FAILED).build();
        });
        return updated[0];
    }

    @Override
    public List<CachedTile> findAll() {
        return new ArrayList<>(rows.values());
    }
}
