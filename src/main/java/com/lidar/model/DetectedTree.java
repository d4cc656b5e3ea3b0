package com.lidar.model;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Point;

/**
 * A tree found by canopy segmentation. Location is in the working coordinate reference.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DetectedTree {

    private String id;

    private Point location;

    /**
     * Canopy height at the tree top, meters
     */
    private double height;

    /**
     * Diameter of a circle with the crown's area, meters. Assumes a round crown.
     */
    private double crownDiameter;

    /**
     * Square meters
     */
    private double crownArea;
}
