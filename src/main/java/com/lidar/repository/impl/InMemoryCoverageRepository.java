package com.lidar.repository.impl;

import com.lidar.model.SourceTile;
import com.lidar.repository.CoverageRepository;

import org.springframework.stereotype.Repository;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Coverage index held in memory behind a JTS STRtree.
 * Writers are serialized and publish a freshly built tree; readers query the current snapshot.
 */
@Repository
public class InMemoryCoverageRepository implements CoverageRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCoverageRepository.class);

    private static final int STRTREE_NODE_CAPACITY = 10;

    private final Map<String, SourceTile> storage = new ConcurrentHashMap<>();

    private volatile STRtree spatialIndex = new STRtree(STRTREE_NODE_CAPACITY);

    @Override
    public synchronized void saveAll(Collection<SourceTile> tiles) {
        if (tiles == null || tiles.isEmpty()) {
            return;
        }

        for (SourceTile tile : tiles) {
            if (tile.getId() == null || tile.getGeometry() == null) {
                throw new IllegalArgumentException("Tile requires a name and a footprint: " + tile.getId());
            }
        }

        for (SourceTile tile : tiles) {
            storage.put(tile.getId(), tile);
        }
        rebuildIndex();
        logger.debug("Committed batch of {} tiles, index now holds {}", tiles.size(), storage.size());
    }

    @Override
    public Optional<SourceTile> findByName(String tileName) {
        return Optional.ofNullable(storage.get(tileName));
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<SourceTile> findIntersecting(Geometry area, String source) {
        STRtree index = spatialIndex;
        List<SourceTile> candidates = index.query(area.getEnvelopeInternal());

        List<SourceTile> results = new ArrayList<>();
        for (SourceTile tile : candidates) {
            if (source != null && !source.equals(tile.getSource())) {
                continue;
            }
            if (tile.intersects(area)) {
                results.add(tile);
            }
        }
        return results;
    }

    @Override
    public synchronized int deleteBySource(String source) {
        List<String> doomed = storage.values().stream()
                .filter(tile -> Objects.equals(source, tile.getSource()))
                .map(SourceTile::getId)
                .collect(Collectors.toList());
        doomed.forEach(storage::remove);
        if (!doomed.isEmpty()) {
            rebuildIndex();
        }
        logger.info("Removed {} tiles of source '{}'", doomed.size(), source);
        return doomed.size();
    }

    @Override
    public long count() {
        return storage.size();
    }

    @Override
    public Map<String, Long> countBySource() {
        return storage.values().stream()
                .collect(Collectors.groupingBy(tile -> String.valueOf(tile.getSource()),
                        TreeMap::new, Collectors.counting()));
    }

    @Override
    public synchronized void flushAll() {
        storage.clear();
        rebuildIndex();
        logger.info("Coverage index flushed");
    }

    private void rebuildIndex() {
        // An STRtree cannot take inserts once queried, so every commit builds a new one
        STRtree newIndex = new STRtree(STRTREE_NODE_CAPACITY);
        for (SourceTile tile : storage.values()) {
            newIndex.insert(tile.getEnvelope(), tile);
        }
        newIndex.build();
        spatialIndex = newIndex;
    }
}
