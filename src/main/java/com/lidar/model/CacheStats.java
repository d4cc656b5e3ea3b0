package com.lidar.model;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;

/**
 * Aggregate figures over the complete rows of the tile cache
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long totalCachedTiles;
    private long totalSizeBytes;
    private long totalAccesses;

    /**
     * Accesses beyond the first touch of each tile, i.e. origin downloads avoided
     */
    private long savedDownloads;

    public double getTotalSizeMb() {
        return Math.round(totalSizeBytes / 1024.0 / 1024.0 * 100.0) / 100.0;
    }
}
