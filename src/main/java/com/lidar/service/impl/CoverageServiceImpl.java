package com.lidar.service.impl;

import com.lidar.aspect.Timed;
import com.lidar.exception.CoverageSeedException;
import com.lidar.exception.InvalidAreaException;
import com.lidar.model.CoverageStats;
import com.lidar.model.SourceTile;
import com.lidar.repository.CoverageRepository;
import com.lidar.service.CoverageService;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Coverage lookups and seeding over the coverage repository
 */
@Service
public class CoverageServiceImpl implements CoverageService {

    private static final Logger logger = LoggerFactory.getLogger(CoverageServiceImpl.class);

    static final int SEED_BATCH_SIZE = 1000;

    @Autowired
    private CoverageRepository coverageRepository;

    @Autowired
    private GeometryFactory geometryFactory;

    // One seeding run per source label at a time
    private final Map<String, ReentrantLock> seedLocks = new ConcurrentHashMap<>();

    @Override
    @Timed("coverage.find")
    public List<SourceTile> findCoverage(Geometry area, String source) {
        validateArea(area);
        List<SourceTile> tiles = new ArrayList<>(coverageRepository.findIntersecting(area, source));
        tiles.sort(SourceTile.PREFERENCE_ORDER);
        logger.debug("Found {} tiles intersecting area (source={})", tiles.size(), source);
        return tiles;
    }

    @Override
    public List<SourceTile> findCoverage(String areaWkt, String source) {
        return findCoverage(parseArea(areaWkt), source);
    }

    @Override
    public boolean hasCoverage(Geometry area) {
        return !findCoverage(area, null).isEmpty();
    }

    @Override
    public Optional<SourceTile> bestTile(Geometry area, String preferredSource) {
        List<SourceTile> tiles = preferredSource != null
                ? findCoverage(area, preferredSource)
                : List.of();
        if (tiles.isEmpty()) {
            if (preferredSource != null) {
                logger.info("No {} tile covers the area, falling back to any source", preferredSource);
            }
            tiles = findCoverage(area, null);
        }
        return tiles.stream().findFirst();
    }

    @Override
    public Geometry parseArea(String areaWkt) {
        if (areaWkt == null || areaWkt.isBlank()) {
            throw new InvalidAreaException("Area geometry is empty");
        }
        try {
            Geometry area = new WKTReader(geometryFactory).read(areaWkt);
            validateArea(area);
            return area;
        } catch (ParseException e) {
            throw new InvalidAreaException("Area is not valid WKT: " + e.getMessage(), e);
        }
    }

    private void validateArea(Geometry area) {
        if (area == null || area.isEmpty()) {
            throw new InvalidAreaException("Area geometry is empty");
        }
        if (area.getDimension() != 2) {
            throw new InvalidAreaException("Area must be a polygon, got " + area.getGeometryType());
        }
        if (!area.isValid()) {
            throw new InvalidAreaException("Area polygon is not valid (self-intersecting?)");
        }
    }

    @Override
    @Timed(value = "coverage.seed", logLevel = Timed.LogLevel.INFO)
    public long seed(String source, List<SourceTile> tiles, boolean clearExisting) {
        ReentrantLock lock = seedLocks.computeIfAbsent(source, key -> new ReentrantLock());
        if (!lock.tryLock()) {
            throw new CoverageSeedException("Seeding already running for source " + source, 0, null);
        }

        long imported = 0;
        try {
            if (clearExisting) {
                int removed = coverageRepository.deleteBySource(source);
                logger.info("Cleared {} existing tiles for source {}", removed, source);
            }

            List<SourceTile> batch = new ArrayList<>(SEED_BATCH_SIZE);
            for (SourceTile tile : tiles) {
                if (tile.getSource() == null) {
                    tile.setSource(source);
                }
                batch.add(tile);
                if (batch.size() >= SEED_BATCH_SIZE) {
                    imported += commit(source, batch, imported);
                    batch = new ArrayList<>(SEED_BATCH_SIZE);
                }
            }
            if (!batch.isEmpty()) {
                imported += commit(source, batch, imported);
            }

            logger.info("Seeded {} tiles for source {}", imported, source);
            return imported;
        } finally {
            lock.unlock();
        }
    }

    private int commit(String source, List<SourceTile> batch, long importedSoFar) {
        try {
            coverageRepository.saveAll(batch);
        } catch (RuntimeException e) {
            throw new CoverageSeedException(String.format(
                "Seeding %s failed after %d tiles: %s", source, importedSoFar, e.getMessage()),
                importedSoFar, e);
        }
        logger.info("Committed batch of {} tiles for source {}, total: {}",
                batch.size(), source, importedSoFar + batch.size());
        return batch.size();
    }

    @Override
    public CoverageStats stats() {
        return CoverageStats.builder()
                .totalTiles(coverageRepository.count())
                .tilesBySource(coverageRepository.countBySource())
                .build();
    }
}
