package com.lidar.model;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Tile cache row, keyed by the tile name derived from the download locator
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CachedTile {

    private String tileName;
    private String sourceUrl;

    private String bucket;
    private String objectKey;

    private CacheState state;

    /**
     * Token of the download attempt that owns the row while it is DOWNLOADING
     */
    private String attemptId;

    private Long fileSizeBytes;
    private Instant downloadDate;

    private Instant lastAccessed;

    @Builder.Default
    private long accessCount = 0;

    public boolean isComplete() {
        return state == CacheState.COMPLETE;
    }
}
