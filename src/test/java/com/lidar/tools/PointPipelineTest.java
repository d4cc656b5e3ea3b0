package com.lidar.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PointPipelineTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testIngestWithArea() throws Exception {
        // Given
        String area = "POLYGON ((-1.7 42.8, -1.6 42.8, -1.6 42.9, -1.7 42.8))";

        // When
        PointPipeline pipeline = PointPipeline.ingest(Path.of("in.laz"), Path.of("out.laz"), area);
        JsonNode stages = objectMapper.readTree(pipeline.toJson(objectMapper)).get("pipeline");

        // Then
        assertEquals(List.of("readers.las", "filters.crop", "filters.outlier", "filters.elm", "writers.las"),
            pipeline.stageTypes());
        assertEquals("in.laz", stages.get(0).get("filename").asText());
        assertEquals(area, stages.get(1).get("polygon").asText());
        assertEquals("statistical", stages.get(2).get("method").asText());
        assertEquals(12, stages.get(2).get("mean_k").asInt());
        assertEquals(2.0, stages.get(2).get("multiplier").asDouble());
        assertEquals("laszip", stages.get(4).get("compression").asText());
    }

    @Test
    void testIngestWithoutAreaSkipsCrop() {
        PointPipeline pipeline = PointPipeline.ingest(Path.of("in.laz"), Path.of("out.laz"), null);

        assertFalse(pipeline.stageTypes().contains("filters.crop"));
    }

    @Test
    void testSurfaces() {
        PointPipeline ground = PointPipeline.groundSurface(Path.of("c.laz"), Path.of("dtm.tif"), 0.5);
        PointPipeline highest = PointPipeline.highestSurface(Path.of("c.laz"), Path.of("dsm.tif"), 0.5);

        assertEquals(List.of("readers.las", "filters.smrf", "filters.range", "writers.gdal"), ground.stageTypes());
        assertEquals("Classification[2:2]", ground.getStages().get(2).get("limits"));
        assertEquals("idw", ground.getStages().get(3).get("output_type"));
        assertEquals("max", highest.getStages().get(1).get("output_type"));
        assertEquals(PointPipeline.NODATA, highest.getStages().get(1).get("nodata"));
    }

    @Test
    void testColorizeAddsNdviDimension() {
        PointPipeline pipeline = PointPipeline.colorize(Path.of("c.laz"), Path.of("ndvi.tif"), Path.of("o.laz"));

        assertEquals("NDVI:1:256.0", pipeline.getStages().get(1).get("dimensions"));
        assertEquals("NDVI=float", pipeline.getStages().get(2).get("extra_dims"));
    }
}
