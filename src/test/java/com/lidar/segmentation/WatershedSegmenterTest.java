package com.lidar.segmentation;

import com.lidar.raster.RasterGrid;
import com.lidar.support.CanopyRasters;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WatershedSegmenterTest {

    @Test
    void testBasinsSplitBetweenMarkers() {
        // Given two hills on one row separated by a low saddle
        RasterGrid canopy = CanopyRasters.flat(7, 1, 0f);
        float[] profile = {1f, 5f, 3f, 1f, 4f, 6f, 2f};
        for (int col = 0; col < profile.length; col++) {
            canopy.set(0, col, profile[col]);
        }
        List<Peak> markers = List.of(new Peak(0, 5, 6f), new Peak(0, 1, 5f));

        // When
        int[] labels = WatershedSegmenter.segment(canopy, markers);

        // Then
        assertArrayEquals(new int[] {2, 2, 2, 1, 1, 1, 1}, labels);
    }

    @Test
    void testBackgroundStaysUnlabelled() {
        RasterGrid canopy = CanopyRasters.flat(5, 1, 0f);
        canopy.set(0, 1, 3f);
        canopy.set(0, 3, 3f);

        int[] labels = WatershedSegmenter.segment(canopy, List.of(new Peak(0, 1, 3f)));

        assertArrayEquals(new int[] {0, 1, 0, 0, 0}, labels);
    }
}
