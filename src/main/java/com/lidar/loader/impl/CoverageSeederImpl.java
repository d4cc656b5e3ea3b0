package com.lidar.loader.impl;

import com.lidar.exception.CoverageSeedException;
import com.lidar.loader.CoverageSeeder;
import com.lidar.model.SourceTile;
import com.lidar.repository.data.ReaderFactory;
import com.lidar.repository.data.SeedSource;
import com.lidar.service.CoverageService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Reads a seed source through the matching reader and hands the tiles to the coverage service
 */
@Component
public class CoverageSeederImpl implements CoverageSeeder {

    private static final Logger logger = LoggerFactory.getLogger(CoverageSeederImpl.class);

    @Autowired
    private CoverageService coverageService;

    @Autowired
    private ReaderFactory readerFactory;

    @Override
    public SeedResult seed(SeedSource seedSource) {
        logger.info("Starting coverage seed from {} ({})", seedSource.getLocation(), seedSource.getType());

        List<SourceTile> tiles;
        try {
            tiles = readerFactory.getReader(seedSource.getType()).read(seedSource);
        } catch (IOException e) {
            throw new CoverageSeedException("Failed to read seed source " + seedSource.getLocation()
                    + ": " + e.getMessage(), 0, e);
        }

        return seedTiles(seedSource.getSourceLabel(), tiles, seedSource.isClearExisting());
    }

    @Override
    public SeedResult seedTiles(String sourceLabel, List<SourceTile> tiles, boolean clearExisting) {
        long startTime = System.currentTimeMillis();
        long imported = coverageService.seed(sourceLabel, tiles, clearExisting);
        long duration = System.currentTimeMillis() - startTime;

        SeedResult result = new SeedResult(sourceLabel, imported, duration);
        logger.info("Coverage seed finished: {}", result);
        return result;
    }
}
