package com.lidar.loader;

import com.lidar.model.SourceTile;
import com.lidar.repository.data.SeedSource;

import java.util.List;

/**
 * Bulk import of tile footprints into the coverage index
 */
public interface CoverageSeeder {

    /**
     * Read the seed source and import its tiles under the source's label
     *
     * @throws com.lidar.exception.CoverageSeedException if reading or committing fails;
     *         batches committed before the failure stay imported
     */
    SeedResult seed(SeedSource seedSource);

    /**
     * Import tiles already in memory
     */
    SeedResult seedTiles(String sourceLabel, List<SourceTile> tiles, boolean clearExisting);

    /**
     * Result of a completed seeding run
     */
    class SeedResult {
        private final String source;
        private final long tilesImported;
        private final long durationMs;

        public SeedResult(String source, long tilesImported, long durationMs) {
            this.source = source;
            this.tilesImported = tilesImported;
            this.durationMs = durationMs;
        }

        public String getSource() { return source; }
        public long getTilesImported() { return tilesImported; }
        public long getDurationMs() { return durationMs; }

        @Override
        public String toString() {
            return String.format("SeedResult{source=%s, tiles=%d, duration=%dms}",
                               source, tilesImported, durationMs);
        }
    }
}
