package com.lidar.model;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Processing options recognised for a job. Null thresholds fall back to the configured defaults.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobConfig {

    @Builder.Default
    private ColorMode colorMode = ColorMode.HEIGHT;

    private boolean detectTrees;

    /**
     * Meters
     */
    private Double treeMinHeight;

    /**
     * Meters
     */
    private Double treeSearchRadius;

    /**
     * Optional NDVI GeoTIFF locator, used only when colorMode is NDVI
     */
    private String ndviSourceUrl;

    /**
     * Preferred coverage source label, e.g. PNOA
     */
    private String source;

    @JsonIgnore
    public boolean wantsSpectralFusion() {
        return colorMode == ColorMode.NDVI && ndviSourceUrl != null && !ndviSourceUrl.isBlank();
    }
}
