package com.lidar.config.serializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.geojson.GeoJsonWriter;

import java.io.IOException;

/**
 * Writes JTS geometries as embedded GeoJSON geometry objects
 */
public class GeometrySerializer extends JsonSerializer<Geometry> {

    @Override
    public void serialize(Geometry geometry, JsonGenerator gen, SerializerProvider serializers)
            throws IOException {
        if (geometry == null) {
            gen.writeNull();
            return;
        }

        // GeoJsonWriter is not thread-safe
        GeoJsonWriter writer = new GeoJsonWriter();
        writer.setEncodeCRS(false);
        gen.writeRawValue(writer.write(geometry));
    }
}
