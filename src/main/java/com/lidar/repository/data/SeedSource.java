package com.lidar.repository.data;

import lombok.Builder;
import lombok.Data;

/**
 * Where coverage footprints come from and how to read their properties
 */
@Data
@Builder
public class SeedSource {

    /**
     * Type of seed source
     */
    public enum SeedSourceType {
        FILE_GEOJSON,
        WFS_GEOJSON
    }

    private SeedSourceType type;

    /**
     * File path, or base URL of the WFS endpoint
     */
    private String location;

    /**
     * Source label stored on every imported tile
     */
    private String sourceLabel;

    /**
     * WFS feature type name, e.g. IDENA:LIDAR_Vuelo
     */
    private String typeName;

    /**
     * Optional WFS bounding box: minx,miny,maxx,maxy
     */
    private String bbox;

    @Builder.Default
    private String urlField = "URL";

    @Builder.Default
    private String nameField = "NOMBRE";

    @Builder.Default
    private String yearField = "AÑO";

    @Builder.Default
    private String densityField = "DENSIDAD";

    /**
     * Remove the label's existing tiles before importing
     */
    private boolean clearExisting;

    /**
     * Create a GeoJSON file source
     */
    public static SeedSource geoJsonFile(String path, String sourceLabel) {
        return SeedSource.builder()
                .type(SeedSourceType.FILE_GEOJSON)
                .location(path)
                .sourceLabel(sourceLabel)
                .build();
    }

    /**
     * Create a WFS source returning GeoJSON
     */
    public static SeedSource wfs(String url, String typeName, String sourceLabel) {
        return SeedSource.builder()
                .type(SeedSourceType.WFS_GEOJSON)
                .location(url)
                .typeName(typeName)
                .sourceLabel(sourceLabel)
                .build();
    }
}
