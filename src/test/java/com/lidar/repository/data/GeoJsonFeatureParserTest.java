package com.lidar.repository.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lidar.model.SourceTile;
import com.lidar.repository.data.impl.GeoJsonFileReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.GeometryFactory;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.FileNotFoundException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GeoJsonFeatureParserTest {

    private static final String SEED_FILE = "src/test/resources/seed/coverage.geojson";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private GeoJsonFileReader fileReader;

    @BeforeEach
    void setUp() {
        fileReader = new GeoJsonFileReader();
        ReflectionTestUtils.setField(fileReader, "objectMapper", objectMapper);
        ReflectionTestUtils.setField(fileReader, "featureParser",
            new GeoJsonFeatureParser(new GeometryFactory(), objectMapper));
    }

    @Test
    void testReadSeedFile() throws Exception {
        // When
        List<SourceTile> tiles = fileReader.read(SeedSource.geoJsonFile(SEED_FILE, "PNOA"));

        // Then - the feature without a URL is skipped
        assertEquals(3, tiles.size());
        Map<String, SourceTile> byName = tiles.stream()
            .collect(Collectors.toMap(SourceTile::getTileName, Function.identity()));

        SourceTile newest = byName.get("PNOA_2023_NAV_610-4740");
        assertEquals(2023, newest.getFlightYear());
        assertEquals(4.0, newest.getPointDensity());
        assertEquals("PNOA", newest.getSource());
        assertEquals(30, ((Number) newest.getMetadata().get("HUSO")).intValue());
        assertTrue(newest.getGeometry().isValid());

        SourceTile alternateFields = byName.get("PNOA_2022_NAV_610-4740");
        assertEquals(2022, alternateFields.getFlightYear());
        assertEquals("https://example.org/lidar/PNOA_2022_NAV_610-4740.laz", alternateFields.getLazUrl());

        SourceTile unnamed = byName.get("tile_4");
        assertNotNull(unnamed);
        assertNull(unnamed.getFlightYear());
        assertNull(unnamed.getPointDensity());
    }

    @Test
    void testMissingFileIsReported() {
        assertThrows(FileNotFoundException.class,
            () -> fileReader.read(SeedSource.geoJsonFile("does/not/exist.geojson", "PNOA")));
    }

    @Test
    void testNumberParsing() {
        assertEquals(2021, GeoJsonFeatureParser.parseYear("2021"));
        assertEquals(2021, GeoJsonFeatureParser.parseYear("2021.0"));
        assertNull(GeoJsonFeatureParser.parseYear("unknown"));
        assertEquals(1.5, GeoJsonFeatureParser.parseDensity("1,5"));
        assertNull(GeoJsonFeatureParser.parseDensity(""));
    }
}
