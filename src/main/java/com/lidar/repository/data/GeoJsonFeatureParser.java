package com.lidar.repository.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lidar.model.SourceTile;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a GeoJSON FeatureCollection of flight footprints into source tiles
 */
@Component
public class GeoJsonFeatureParser {

    private static final Logger logger = LoggerFactory.getLogger(GeoJsonFeatureParser.class);

    // Property names used by the regional download services besides the configured ones
    static final String ALT_URL_FIELD = "URL_DESCARGA";
    static final String ALT_NAME_FIELD = "FICHERO";
    static final String ALT_YEAR_FIELD = "ANYO";

    private final GeometryFactory geometryFactory;
    private final ObjectMapper objectMapper;

    public GeoJsonFeatureParser(GeometryFactory geometryFactory, ObjectMapper objectMapper) {
        this.geometryFactory = geometryFactory;
        this.objectMapper = objectMapper;
    }

    /**
     * Parse every usable feature. Features without a download locator or with an
     * unusable footprint are skipped with a warning.
     *
     * @throws IOException if the document is not a FeatureCollection
     */
    public List<SourceTile> parse(JsonNode root, SeedSource source) throws IOException {
        JsonNode features = root.path("features");
        if (!features.isArray()) {
            throw new IOException("Expected a GeoJSON FeatureCollection with a features array");
        }

        GeoJsonReader geoJsonReader = new GeoJsonReader(geometryFactory);
        Set<String> knownFields = Set.of(source.getUrlField(), source.getNameField(),
                source.getYearField(), source.getDensityField(),
                ALT_URL_FIELD, ALT_NAME_FIELD, ALT_YEAR_FIELD);

        List<SourceTile> tiles = new ArrayList<>();
        int index = 0;
        int skipped = 0;
        Instant now = Instant.now();

        for (JsonNode feature : features) {
            index++;
            JsonNode props = feature.path("properties");

            String url = text(props, source.getUrlField(), ALT_URL_FIELD);
            if (url == null) {
                logger.warn("Feature {} has no download URL, skipping", index);
                skipped++;
                continue;
            }

            Geometry footprint = readFootprint(geoJsonReader, feature.path("geometry"), index);
            if (footprint == null) {
                skipped++;
                continue;
            }

            String name = text(props, source.getNameField(), ALT_NAME_FIELD);
            if (name == null) {
                name = "tile_" + index;
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            props.fields().forEachRemaining(entry -> {
                if (!knownFields.contains(entry.getKey()) && !entry.getValue().isNull()) {
                    metadata.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), Object.class));
                }
            });

            tiles.add(SourceTile.builder()
                    .id(name)
                    .source(source.getSourceLabel())
                    .flightYear(parseYear(text(props, source.getYearField(), ALT_YEAR_FIELD)))
                    .pointDensity(parseDensity(text(props, source.getDensityField(), null)))
                    .lazUrl(url)
                    .geometry(footprint)
                    .metadata(metadata.isEmpty() ? null : metadata)
                    .createdAt(now)
                    .build());
        }

        logger.info("Parsed {} tiles from {} features ({} skipped)", tiles.size(), index, skipped);
        return tiles;
    }

    private Geometry readFootprint(GeoJsonReader reader, JsonNode geometryNode, int index) {
        if (geometryNode.isMissingNode() || geometryNode.isNull()) {
            logger.warn("Feature {} has no geometry, skipping", index);
            return null;
        }
        try {
            Geometry geometry = reader.read(geometryNode.toString());
            if (geometry.isEmpty() || !geometry.isValid() || geometry.getDimension() != 2) {
                logger.warn("Feature {} has an invalid or non-polygonal footprint, skipping", index);
                return null;
            }
            return geometry;
        } catch (ParseException e) {
            logger.warn("Feature {} geometry could not be parsed: {}", index, e.getMessage());
            return null;
        }
    }

    private static String text(JsonNode props, String field, String alternate) {
        JsonNode value = props.get(field);
        if ((value == null || value.isNull()) && alternate != null) {
            value = props.get(alternate);
        }
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    static Integer parseYear(String value) {
        if (value == null) {
            return null;
        }
        try {
            return (int) Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Double parseDensity(String value) {
        if (value == null) {
            return null;
        }
        try {
            // decimal comma in some catalogs
            return Double.parseDouble(value.replace(',', '.'));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
