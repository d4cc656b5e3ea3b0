package com.lidar.repository.data;

import com.lidar.model.SourceTile;

import java.io.IOException;
import java.util.List;

/**
 * Reads coverage tiles out of an external feature source
 */
public interface SeedRecordReader {

    /**
     * Read every usable feature of the source as a tile. Features without a download
     * locator are skipped.
     */
    List<SourceTile> read(SeedSource source) throws IOException;

    /**
     * Check if this reader handles the given source type
     */
    boolean supports(SeedSource.SeedSourceType type);
}
