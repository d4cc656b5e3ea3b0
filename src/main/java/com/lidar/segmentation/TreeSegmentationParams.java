package com.lidar.segmentation;

import lombok.Value;

/**
 * Thresholds for tree detection, in meters
 */
@Value
public class TreeSegmentationParams {

    /**
     * Lowest canopy height that can be a tree
     */
    double minHeight;

    /**
     * Minimum spacing between two tree tops
     */
    double searchRadius;

    public TreeSegmentationParams(double minHeight, double searchRadius) {
        if (minHeight < 0 || searchRadius <= 0) {
            throw new IllegalArgumentException(String.format(
                "Invalid segmentation thresholds: minHeight=%s, searchRadius=%s", minHeight, searchRadius));
        }
        this.minHeight = minHeight;
        this.searchRadius = searchRadius;
    }
}
