package com.lidar.segmentation;

import com.lidar.raster.RasterGrid;
import com.lidar.support.CanopyRasters;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeakFinderTest {

    @Test
    void testCloseCandidatesKeepHighest() {
        RasterGrid image = CanopyRasters.flat(20, 20, 0f);
        image.set(10, 8, 5f);
        image.set(10, 10, 4f);
        image.set(10, 17, 3f);

        List<Peak> peaks = PeakFinder.find(image, 2, 1.0);

        assertEquals(2, peaks.size());
        assertEquals(8, peaks.get(0).getCol());
        assertEquals(17, peaks.get(1).getCol());
    }

    @Test
    void testBorderAndThresholdExcluded() {
        RasterGrid image = CanopyRasters.flat(10, 10, 0f);
        image.set(1, 5, 9f);
        image.set(5, 5, 1f);

        assertTrue(PeakFinder.find(image, 2, 1.0).isEmpty());
    }

    @Test
    void testMinDistanceMustBePositive() {
        assertThrows(IllegalArgumentException.class,
            () -> PeakFinder.find(CanopyRasters.flat(3, 3, 0f), 0, 0.0));
    }
}
