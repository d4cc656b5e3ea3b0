package com.lidar.repository;

import com.lidar.model.SourceTile;
import org.locationtech.jts.geom.Geometry;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for the spatial catalog of source tiles
 */
public interface CoverageRepository {

    /**
     * Commit a batch of tiles atomically: either every tile becomes visible or none does.
     * A tile whose name already exists replaces the previous entry.
     */
    void saveAll(Collection<SourceTile> tiles);

    /**
     * Get a tile by name
     */
    Optional<SourceTile> findByName(String tileName);

    /**
     * Tiles whose footprint intersects the geometry, optionally restricted to one source label.
     * No particular order.
     */
    List<SourceTile> findIntersecting(Geometry area, String source);

    /**
     * Remove every tile of a source label
     *
     * @return number of tiles removed
     */
    int deleteBySource(String source);

    long count();

    /**
     * Tile counts keyed by source label
     */
    Map<String, Long> countBySource();

    /**
     * Clear the whole index
     */
    void flushAll();
}
