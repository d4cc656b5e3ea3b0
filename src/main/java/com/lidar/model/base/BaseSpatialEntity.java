package com.lidar.model.base;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Base entity carrying a footprint geometry
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BaseSpatialEntity<ID> extends BaseEntity<ID> {

    /**
     * Footprint of the entity in geographic coordinates
     */
    private Geometry geometry;

    /**
     * Bounding box used as the spatial index key
     */
    @JsonIgnore
    public Envelope getEnvelope() {
        return geometry != null ? geometry.getEnvelopeInternal() : new Envelope();
    }

    /**
     * Check if this entity's footprint intersects the given geometry
     */
    public boolean intersects(Geometry other) {
        return geometry != null && other != null && geometry.intersects(other);
    }
}
