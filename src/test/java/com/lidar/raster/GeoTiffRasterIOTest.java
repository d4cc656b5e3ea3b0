package com.lidar.raster;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GeoTiffRasterIOTest {

    @TempDir
    Path tempDir;

    private final GeoTiffRasterIO rasterIO = new GeoTiffRasterIO();

    @Test
    void testWrittenRasterKeepsValuesAndGeoreference() throws Exception {
        // Given
        RasterGrid grid = new RasterGrid(4, 3, GeoTransform.northUp(610000.0, 4740000.0, 0.5), null);
        grid.set(0, 0, 1.5f);
        grid.set(2, 3, 12.25f);
        grid.set(1, 2, -9999f);
        Path file = tempDir.resolve("chm.tif");

        // When
        rasterIO.write(grid, file);
        RasterGrid read = rasterIO.read(file, -9999.0);

        // Then
        assertEquals(4, read.getWidth());
        assertEquals(3, read.getHeight());
        assertEquals(1.5f, read.get(0, 0));
        assertEquals(12.25f, read.get(2, 3));
        assertFalse(read.isDefined(1, 2));
        assertEquals(610000.0, read.getTransform().getOriginX(), 1e-6);
        assertEquals(4740000.0, read.getTransform().getOriginY(), 1e-6);
        assertEquals(0.5, read.getTransform().resolution(), 1e-9);
        assertEquals(-0.5, read.getTransform().getPixelHeight(), 1e-9);
    }

    @Test
    void testTransformPixelCentres() {
        GeoTransform transform = GeoTransform.northUp(100.0, 200.0, 2.0);

        assertEquals(101.0, transform.columnToX(0), 1e-9);
        assertEquals(199.0, transform.rowToY(0), 1e-9);
        assertEquals(3, transform.xToColumn(107.9));
        assertEquals(2, transform.yToRow(194.5));
        assertEquals(4.0, transform.pixelArea(), 1e-9);
    }
}
