package com.lidar.raster;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * North-up affine transform from pixel to world coordinates, anchored at the outer
 * corner of the top-left pixel. {@code pixelHeight} is negative for north-up rasters.
 */
@Value
@AllArgsConstructor
public class GeoTransform {

    double originX;
    double pixelWidth;
    double originY;
    double pixelHeight;

    /**
     * Transform for a grid whose top-left corner is at (minX, maxY)
     */
    public static GeoTransform northUp(double minX, double maxY, double resolution) {
        return new GeoTransform(minX, resolution, maxY, -resolution);
    }

    /**
     * World X of the pixel centre
     */
    public double columnToX(double col) {
        return originX + (col + 0.5) * pixelWidth;
    }

    /**
     * World Y of the pixel centre
     */
    public double rowToY(double row) {
        return originY + (row + 0.5) * pixelHeight;
    }

    public int xToColumn(double x) {
        return (int) Math.floor((x - originX) / pixelWidth);
    }

    public int yToRow(double y) {
        return (int) Math.floor((y - originY) / pixelHeight);
    }

    /**
     * Area of one pixel in squared world units
     */
    public double pixelArea() {
        return Math.abs(pixelWidth * pixelHeight);
    }

    public double resolution() {
        return Math.abs(pixelWidth);
    }
}
