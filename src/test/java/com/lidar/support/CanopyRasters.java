package com.lidar.support;

import com.lidar.raster.GeoTransform;
import com.lidar.raster.RasterGrid;

/**
 * Synthetic canopy rasters for segmentation tests
 */
public final class CanopyRasters {

    public static final double RESOLUTION = 0.5;
    public static final double ORIGIN_X = 610000.0;
    public static final double ORIGIN_Y = 4740000.0;

    private CanopyRasters() {
    }

    public static RasterGrid flat(int width, int height, float value) {
        RasterGrid grid = new RasterGrid(width, height,
                GeoTransform.northUp(ORIGIN_X, ORIGIN_Y, RESOLUTION), null);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                grid.set(row, col, value);
            }
        }
        return grid;
    }

    /**
     * Gaussian bump of the given amplitude centred on a pixel
     */
    public static RasterGrid gaussianBump(int width, int height, int peakRow, int peakCol,
                                          float amplitude, double sigmaPixels) {
        RasterGrid grid = flat(width, height, 0f);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                double d2 = Math.pow(row - peakRow, 2) + Math.pow(col - peakCol, 2);
                grid.set(row, col, (float) (amplitude * Math.exp(-d2 / (2 * sigmaPixels * sigmaPixels))));
            }
        }
        return grid;
    }

    /**
     * Cones of the given apex height and base radius (pixels) on flat zero ground
     *
     * @param centres {row, col} pairs
     */
    public static RasterGrid cones(int width, int height, float apexHeight, double radiusPixels, int[]... centres) {
        RasterGrid grid = flat(width, height, 0f);
        for (int[] centre : centres) {
            for (int row = 0; row < height; row++) {
                for (int col = 0; col < width; col++) {
                    double distance = Math.hypot(row - centre[0], col - centre[1]);
                    float value = (float) (apexHeight * (1 - distance / radiusPixels));
                    if (value > grid.get(row, col)) {
                        grid.set(row, col, value);
                    }
                }
            }
        }
        return grid;
    }
}
