package com.lidar.segmentation;

import com.lidar.raster.GeoTransform;
import com.lidar.raster.RasterGrid;

/**
 * Canopy height = highest-point surface minus ground surface, on the highest-point grid.
 * Negative heights and cells undefined in either surface become 0.
 */
public final class CanopyHeightModel {

    private CanopyHeightModel() {
    }

    public static RasterGrid compute(RasterGrid surface, RasterGrid ground) {
        RasterGrid chm = surface.blankCopy();
        GeoTransform transform = surface.getTransform();
        GeoTransform groundTransform = ground.getTransform();

        for (int row = 0; row < surface.getHeight(); row++) {
            int groundRow = groundTransform.yToRow(transform.rowToY(row));
            for (int col = 0; col < surface.getWidth(); col++) {
                int groundCol = groundTransform.xToColumn(transform.columnToX(col));
                if (!surface.isDefined(row, col)
                        || !ground.contains(groundRow, groundCol)
                        || !ground.isDefined(groundRow, groundCol)) {
                    continue;
                }
                float height = surface.get(row, col) - ground.get(groundRow, groundCol);
                if (height > 0 && Float.isFinite(height)) {
                    chm.set(row, col, height);
                }
            }
        }
        return chm;
    }

    /**
     * Keep cells at or above the minimum height, zero the rest
     */
    public static RasterGrid threshold(RasterGrid chm, double minHeight) {
        RasterGrid masked = chm.blankCopy();
        for (int row = 0; row < chm.getHeight(); row++) {
            for (int col = 0; col < chm.getWidth(); col++) {
                float value = chm.get(row, col);
                if (chm.isDefined(row, col) && value >= minHeight) {
                    masked.set(row, col, value);
                }
            }
        }
        return masked;
    }
}
