package com.lidar.service;

import com.lidar.model.CoverageStats;
import com.lidar.model.SourceTile;
import org.locationtech.jts.geom.Geometry;

import java.util.List;
import java.util.Optional;

/**
 * Spatial catalog answering which source tiles cover an area
 */
public interface CoverageService {

    /**
     * Tiles intersecting the area, newest flight first then densest, unknowns last
     *
     * @param source optional source label filter, null for any
     * @throws com.lidar.exception.InvalidAreaException if the area is empty or invalid
     */
    List<SourceTile> findCoverage(Geometry area, String source);

    /**
     * Same as {@link #findCoverage(Geometry, String)} for an area given as WKT
     */
    List<SourceTile> findCoverage(String areaWkt, String source);

    boolean hasCoverage(Geometry area);

    /**
     * Best tile of the preferred source, falling back to the best tile of any source
     */
    Optional<SourceTile> bestTile(Geometry area, String preferredSource);

    /**
     * Parse and validate an area polygon given as WKT
     *
     * @throws com.lidar.exception.InvalidAreaException if the text does not describe a valid polygon
     */
    Geometry parseArea(String areaWkt);

    /**
     * Import tiles for one source label in batches. Each committed batch stays
     * imported if a later one fails.
     *
     * @param clearExisting remove the label's current tiles first
     * @return number of tiles imported
     * @throws com.lidar.exception.CoverageSeedException if a batch cannot be committed,
     *         or the label is already being seeded
     */
    long seed(String source, List<SourceTile> tiles, boolean clearExisting);

    CoverageStats stats();
}
