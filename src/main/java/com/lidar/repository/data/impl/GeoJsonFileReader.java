package com.lidar.repository.data.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lidar.model.SourceTile;
import com.lidar.repository.data.GeoJsonFeatureParser;
import com.lidar.repository.data.SeedRecordReader;
import com.lidar.repository.data.SeedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;

/**
 * Reads footprints from a GeoJSON file on local disk
 */
@Component
public class GeoJsonFileReader implements SeedRecordReader {

    private static final Logger logger = LoggerFactory.getLogger(GeoJsonFileReader.class);

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private GeoJsonFeatureParser featureParser;

    @Override
    public List<SourceTile> read(SeedSource source) throws IOException {
        File file = new File(source.getLocation());
        if (!file.isFile()) {
            throw new FileNotFoundException("Seed file not found: " + source.getLocation());
        }
        logger.info("Reading coverage footprints from {}", file.getAbsolutePath());
        JsonNode root = objectMapper.readTree(file);
        return featureParser.parse(root, source);
    }

    @Override
    public boolean supports(SeedSource.SeedSourceType type) {
        return type == SeedSource.SeedSourceType.FILE_GEOJSON;
    }
}
