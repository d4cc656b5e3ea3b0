package com.lidar.segmentation;

import com.lidar.raster.RasterGrid;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds tree-top candidates: cells that are the maximum of their
 * (2 * minDistance + 1) window and exceed the threshold. Cells closer than
 * {@code minDistance} to the raster edge are ignored. Among candidates closer than
 * or at {@code minDistance} (Chebyshev) the higher one wins.
 */
public final class PeakFinder {

    private PeakFinder() {
    }

    public static List<Peak> find(RasterGrid image, int minDistance, double threshold) {
        if (minDistance < 1) {
            throw new IllegalArgumentException("minDistance must be at least 1, got " + minDistance);
        }
        int width = image.getWidth();
        int height = image.getHeight();

        List<Peak> candidates = new ArrayList<>();
        for (int row = minDistance; row < height - minDistance; row++) {
            for (int col = minDistance; col < width - minDistance; col++) {
                float value = image.get(row, col);
                if (value > threshold && isWindowMaximum(image, row, col, minDistance)) {
                    candidates.add(new Peak(row, col, value));
                }
            }
        }

        candidates.sort(Comparator.comparing(Peak::getValue).reversed()
                .thenComparing(Peak::getRow)
                .thenComparing(Peak::getCol));

        List<Peak> accepted = new ArrayList<>();
        for (Peak candidate : candidates) {
            boolean tooClose = false;
            for (Peak kept : accepted) {
                int distance = Math.max(Math.abs(kept.getRow() - candidate.getRow()),
                        Math.abs(kept.getCol() - candidate.getCol()));
                if (distance <= minDistance) {
                    tooClose = true;
                    break;
                }
            }
            if (!tooClose) {
                accepted.add(candidate);
            }
        }
        return accepted;
    }

    private static boolean isWindowMaximum(RasterGrid image, int row, int col, int radius) {
        float value = image.get(row, col);
        for (int r = row - radius; r <= row + radius; r++) {
            for (int c = col - radius; c <= col + radius; c++) {
                if (image.get(r, c) > value) {
                    return false;
                }
            }
        }
        return true;
    }
}
