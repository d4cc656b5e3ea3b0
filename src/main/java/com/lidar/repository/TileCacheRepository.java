package com.lidar.repository;

import com.lidar.model.CachedTile;

import java.util.List;
import java.util.Optional;

/**
 * Index of cached source tiles. Every mutation is atomic per tile name.
 */
public interface TileCacheRepository {

    Optional<CachedTile> findByName(String tileName);

    /**
     * If the tile is complete, bump its access counters and return the updated row
     */
    Optional<CachedTile> recordHit(String tileName);

    /**
     * Claim the row for a new download attempt. Inserts a DOWNLOADING row, or resets
     * a FAILED or DOWNLOADING one under the new attempt token.
     */
    CachedTile startDownload(CachedTile downloading);

    /**
     * Flip the row to COMPLETE. Last writer wins when attempts race.
     */
    CachedTile markComplete(String tileName, String attemptId, long fileSizeBytes);

    /**
     * Flip the row to FAILED, but only while it still belongs to this attempt and is not complete
     *
     * @return true if the row was updated
     */
    boolean markFailed(String tileName, String attemptId);

    List<CachedTile> findAll();
}
