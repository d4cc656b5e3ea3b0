package com.lidar.config.serializer;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.geojson.GeoJsonReader;

import java.io.IOException;

/**
 * Reads JTS geometries from a WKT string, a {"wkt": ...} object or a GeoJSON geometry object
 */
public class GeometryDeserializer extends JsonDeserializer<Geometry> {

    private final GeometryFactory geometryFactory;

    public GeometryDeserializer(GeometryFactory geometryFactory) {
        this.geometryFactory = geometryFactory;
    }

    @Override
    public Geometry deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);

        if (node == null || node.isNull()) {
            return null;
        }

        try {
            if (node.isTextual()) {
                return readWkt(node.asText());
            }
            if (node.has("wkt")) {
                return readWkt(node.get("wkt").asText());
            }
            if (node.has("type") && node.has("coordinates")) {
                return new GeoJsonReader(geometryFactory).read(node.toString());
            }
        } catch (ParseException e) {
            throw new IOException("Invalid geometry: " + node, e);
        }

        throw new IOException("Unsupported geometry format. Expected WKT or a GeoJSON geometry.");
    }

    private Geometry readWkt(String wkt) throws ParseException {
        // Blank geometry means "no area", never an empty polygon
        if (wkt == null || wkt.isBlank()) {
            return null;
        }
        return new WKTReader(geometryFactory).read(wkt);
    }
}
