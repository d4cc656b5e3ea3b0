package com.lidar.model;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.EqualsAndHashCode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.lidar.model.base.BaseSpatialEntity;

import java.util.Comparator;
import java.util.Map;

/**
 * A source point-cloud tile in the coverage index. The id is the stable tile name
 * and the inherited geometry is the tile footprint (EPSG:4326).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SourceTile extends BaseSpatialEntity<String> {

    /**
     * Newest flight first, then densest; unknown values sort last
     */
    public static final Comparator<SourceTile> PREFERENCE_ORDER =
            Comparator.comparing(SourceTile::getFlightYear, Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(SourceTile::getPointDensity, Comparator.nullsLast(Comparator.reverseOrder()));

    /**
     * Source label, e.g. PNOA or IDENA
     */
    private String source;

    private Integer flightYear;

    /**
     * Points per square meter
     */
    private Double pointDensity;

    /**
     * Download locator of the LAZ file
     */
    private String lazUrl;

    private Map<String, Object> metadata;

    @JsonIgnore
    public String getTileName() {
        return getId();
    }
}
