package com.lidar.loader;

import com.lidar.config.LidarProperties;
import com.lidar.repository.data.SeedSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Imports the configured GeoJSON footprint file when the application starts
 */
@Slf4j
@Component
public class CoverageSeedRunner implements ApplicationRunner {

    private final CoverageSeeder coverageSeeder;
    private final LidarProperties properties;

    public CoverageSeedRunner(CoverageSeeder coverageSeeder, LidarProperties properties) {
        this.coverageSeeder = coverageSeeder;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        LidarProperties.Coverage coverage = properties.getCoverage();
        if (coverage.getSeedFile() == null || coverage.getSeedFile().isBlank()) {
            log.debug("No coverage seed file configured");
            return;
        }

        SeedSource source = SeedSource.geoJsonFile(coverage.getSeedFile(), coverage.getSeedSource());
        source.setClearExisting(coverage.isSeedClearExisting());
        coverageSeeder.seed(source);
    }
}
