package com.lidar.raster;

import java.util.Arrays;

/**
 * Single-band float raster in row-major order with its georeference.
 * A cell is undefined when it holds NaN or the nodata value.
 */
public class RasterGrid {

    private final int width;
    private final int height;
    private final float[] data;
    private final GeoTransform transform;
    private final Double nodata;

    public RasterGrid(int width, int height, GeoTransform transform, Double nodata) {
        this(width, height, new float[width * height], transform, nodata);
    }

    public RasterGrid(int width, int height, float[] data, GeoTransform transform, Double nodata) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster size must be positive: " + width + "x" + height);
        }
        if (data.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " cells, got " + data.length);
        }
        this.width = width;
        this.height = height;
        this.data = data;
        this.transform = transform;
        this.nodata = nodata;
    }

    /**
     * Raster of the same shape and georeference filled with zeros, without nodata
     */
    public RasterGrid blankCopy() {
        return new RasterGrid(width, height, transform, null);
    }

    public RasterGrid copy() {
        return new RasterGrid(width, height, Arrays.copyOf(data, data.length), transform, nodata);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public GeoTransform getTransform() {
        return transform;
    }

    public Double getNodata() {
        return nodata;
    }

    public float get(int row, int col) {
        return data[row * width + col];
    }

    public void set(int row, int col, float value) {
        data[row * width + col] = value;
    }

    public boolean isDefined(int row, int col) {
        float value = get(row, col);
        return !Float.isNaN(value) && (nodata == null || value != nodata.floatValue());
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }

    /**
     * Backing array, row-major
     */
    public float[] data() {
        return data;
    }
}
