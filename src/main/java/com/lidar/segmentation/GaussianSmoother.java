package com.lidar.segmentation;

import com.lidar.raster.RasterGrid;

/**
 * Separable Gaussian blur. The kernel reaches four sigmas and edges are mirrored
 * (d c b a | a b c d | d c b a).
 */
public final class GaussianSmoother {

    private static final double TRUNCATE = 4.0;

    private GaussianSmoother() {
    }

    public static RasterGrid smooth(RasterGrid input, double sigma) {
        double[] kernel = kernel(sigma);
        int radius = kernel.length / 2;
        int width = input.getWidth();
        int height = input.getHeight();

        float[] horizontal = new float[width * height];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                double sum = 0;
                for (int k = -radius; k <= radius; k++) {
                    sum += kernel[k + radius] * value(input, row, mirror(col + k, width));
                }
                horizontal[row * width + col] = (float) sum;
            }
        }

        RasterGrid output = input.blankCopy();
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                double sum = 0;
                for (int k = -radius; k <= radius; k++) {
                    sum += kernel[k + radius] * horizontal[mirror(row + k, height) * width + col];
                }
                output.set(row, col, (float) sum);
            }
        }
        return output;
    }

    static double[] kernel(double sigma) {
        int radius = (int) (TRUNCATE * sigma + 0.5);
        double[] kernel = new double[2 * radius + 1];
        double total = 0;
        for (int i = -radius; i <= radius; i++) {
            kernel[i + radius] = Math.exp(-0.5 * i * i / (sigma * sigma));
            total += kernel[i + radius];
        }
        for (int i = 0; i < kernel.length; i++) {
            kernel[i] /= total;
        }
        return kernel;
    }

    static int mirror(int index, int size) {
        if (size == 1) {
            return 0;
        }
        while (index < 0 || index >= size) {
            index = index < 0 ? -index - 1 : 2 * size - index - 1;
        }
        return index;
    }

    private static float value(RasterGrid grid, int row, int col) {
        return grid.isDefined(row, col) ? grid.get(row, col) : 0f;
    }
}
