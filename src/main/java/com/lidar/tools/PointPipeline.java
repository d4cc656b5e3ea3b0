package com.lidar.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Declarative point-cloud pipeline: an ordered list of typed stages with options,
 * rendered to the toolkit's JSON form {@code {"pipeline": [...]}}.
 */
public class PointPipeline {

    public static final double NODATA = -9999.0;

    private final List<Map<String, Object>> stages = new ArrayList<>();

    public static PointPipeline create() {
        return new PointPipeline();
    }

    public PointPipeline stage(String type) {
        return stage(type, Map.of());
    }

    public PointPipeline stage(String type, Map<String, Object> options) {
        Map<String, Object> stage = new LinkedHashMap<>();
        stage.put("type", type);
        stage.putAll(options);
        stages.add(stage);
        return this;
    }

    public PointPipeline readLas(Path input) {
        return stage("readers.las", Map.of("filename", input.toString()));
    }

    public List<Map<String, Object>> getStages() {
        return Collections.unmodifiableList(stages);
    }

    public List<String> stageTypes() {
        return stages.stream().map(s -> (String) s.get("type")).collect(Collectors.toList());
    }

    public String toJson(ObjectMapper objectMapper) {
        try {
            return objectMapper.writeValueAsString(Map.of("pipeline", stages));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Pipeline stages are not serializable", e);
        }
    }

    /**
     * Crop to the area (when given), drop statistical outliers, flag low noise, write compressed LAS
     *
     * @param areaWkt crop polygon in EPSG:4326, or null to keep the whole file
     */
    public static PointPipeline ingest(Path input, Path output, String areaWkt) {
        PointPipeline pipeline = create().readLas(input);
        if (areaWkt != null) {
            pipeline.stage("filters.crop", Map.of("polygon", areaWkt, "a_srs", "EPSG:4326"));
        }
        return pipeline
                .stage("filters.outlier", Map.of("method", "statistical", "mean_k", 12, "multiplier", 2.0))
                .stage("filters.elm")
                .stage("writers.las", Map.of("filename", output.toString(), "compression", "laszip"));
    }

    /**
     * Attach the first raster band as an NDVI dimension, scaled by 256
     */
    public static PointPipeline colorize(Path input, Path raster, Path output) {
        return create().readLas(input)
                .stage("filters.colorization", Map.of(
                        "raster", raster.toString(),
                        "dimensions", "NDVI:1:256.0"))
                .stage("writers.las", Map.of(
                        "filename", output.toString(),
                        "compression", "laszip",
                        "extra_dims", "NDVI=float"));
    }

    /**
     * Classify ground and grid it with inverse-distance interpolation
     */
    public static PointPipeline groundSurface(Path input, Path output, double resolution) {
        return create().readLas(input)
                .stage("filters.smrf")
                .stage("filters.range", Map.of("limits", "Classification[2:2]"))
                .stage("writers.gdal", gridOptions(output, resolution, "idw"));
    }

    /**
     * Grid the highest return of every cell
     */
    public static PointPipeline highestSurface(Path input, Path output, double resolution) {
        return create().readLas(input)
                .stage("writers.gdal", gridOptions(output, resolution, "max"));
    }

    private static Map<String, Object> gridOptions(Path output, double resolution, String outputType) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("filename", output.toString());
        options.put("resolution", resolution);
        options.put("output_type", outputType);
        options.put("data_type", "float32");
        options.put("nodata", NODATA);
        options.put("gdaldriver", "GTiff");
        return options;
    }
}
