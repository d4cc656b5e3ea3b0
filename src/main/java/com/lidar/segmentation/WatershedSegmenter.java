package com.lidar.segmentation;

import com.lidar.raster.RasterGrid;

import java.util.List;
import java.util.PriorityQueue;

/**
 * Marker-controlled watershed on the inverted canopy: basins grow from each tree top
 * downhill through 4-connected cells with positive canopy, highest cells first.
 * Labels are 1-based in marker order; 0 is background.
 */
public final class WatershedSegmenter {

    private static final int[][] NEIGHBOURS = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};

    private WatershedSegmenter() {
    }

    public static int[] segment(RasterGrid canopy, List<Peak> markers) {
        int width = canopy.getWidth();
        int height = canopy.getHeight();
        int[] labels = new int[width * height];

        // inverted height, then insertion order so ties flood breadth-first
        PriorityQueue<long[]> queue = new PriorityQueue<>((a, b) -> {
            int byValue = Double.compare(Double.longBitsToDouble(a[0]), Double.longBitsToDouble(b[0]));
            return byValue != 0 ? byValue : Long.compare(a[1], b[1]);
        });
        long age = 0;

        for (int i = 0; i < markers.size(); i++) {
            Peak marker = markers.get(i);
            int index = marker.getRow() * width + marker.getCol();
            if (!inMask(canopy, marker.getRow(), marker.getCol()) || labels[index] != 0) {
                continue;
            }
            labels[index] = i + 1;
            queue.add(entry(canopy, marker.getRow(), marker.getCol(), index, age++));
        }

        while (!queue.isEmpty()) {
            int index = (int) queue.poll()[2];
            int row = index / width;
            int col = index % width;
            for (int[] offset : NEIGHBOURS) {
                int r = row + offset[0];
                int c = col + offset[1];
                if (!canopy.contains(r, c) || !inMask(canopy, r, c)) {
                    continue;
                }
                int neighbour = r * width + c;
                if (labels[neighbour] == 0) {
                    labels[neighbour] = labels[index];
                    queue.add(entry(canopy, r, c, neighbour, age++));
                }
            }
        }
        return labels;
    }

    private static long[] entry(RasterGrid canopy, int row, int col, int index, long age) {
        return new long[] {Double.doubleToLongBits(-canopy.get(row, col)), age, index};
    }

    private static boolean inMask(RasterGrid canopy, int row, int col) {
        return canopy.isDefined(row, col) && canopy.get(row, col) > 0;
    }
}
