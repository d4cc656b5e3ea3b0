package com.lidar.raster;

import lombok.extern.slf4j.Slf4j;
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Reads and writes single-band float GeoTIFFs georeferenced by pixel scale and tie point
 */
@Slf4j
@Component
public class GeoTiffRasterIO {

    /**
     * Read the first band of a GeoTIFF
     *
     * @param nodata value marking empty cells, or null
     * @throws IOException if the file is unreadable or carries no pixel scale and tie point
     */
    public RasterGrid read(Path file, Double nodata) throws IOException {
        TIFFImage image = TiffReader.readTiff(file.toFile());
        FileDirectory directory = image.getFileDirectory();
        int width = directory.getImageWidth().intValue();
        int height = directory.getImageHeight().intValue();

        double[] scale = doubles(directory.get(FieldTagType.ModelPixelScale));
        double[] tiepoint = doubles(directory.get(FieldTagType.ModelTiepoint));
        if (scale == null || scale.length < 2 || tiepoint == null || tiepoint.length < 6) {
            throw new IOException("Raster " + file.getFileName() + " is not georeferenced");
        }
        // tie point maps raster (i, j) to model (x, y)
        double originX = tiepoint[3] - tiepoint[0] * scale[0];
        double originY = tiepoint[4] + tiepoint[1] * scale[1];
        GeoTransform transform = new GeoTransform(originX, scale[0], originY, -scale[1]);

        Rasters rasters = directory.readRasters();
        float[] data = new float[width * height];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                Number sample = rasters.getPixelSample(0, col, row);
                data[row * width + col] = sample == null ? Float.NaN : sample.floatValue();
            }
        }
        log.debug("Read {}x{} raster {}", width, height, file.getFileName());
        return new RasterGrid(width, height, data, transform, nodata);
    }

    /**
     * Write the grid as an uncompressed 32-bit float GeoTIFF
     */
    public void write(RasterGrid grid, Path file) throws IOException {
        int width = grid.getWidth();
        int height = grid.getHeight();

        Rasters rasters = new Rasters(width, height, 1, FieldType.FLOAT);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                rasters.setFirstPixelSample(col, row, grid.get(row, col));
            }
        }

        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setBitsPerSample(FieldType.FLOAT.getBits());
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(1);
        directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(TiffConstants.SAMPLE_FORMAT_FLOAT);

        GeoTransform transform = grid.getTransform();
        List<Double> scale = List.of(transform.getPixelWidth(), -transform.getPixelHeight(), 0.0);
        List<Double> tiepoint = List.of(0.0, 0.0, 0.0, transform.getOriginX(), transform.getOriginY(), 0.0);
        directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelPixelScale, FieldType.DOUBLE,
                scale.size(), new ArrayList<>(scale)));
        directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelTiepoint, FieldType.DOUBLE,
                tiepoint.size(), new ArrayList<>(tiepoint)));
        directory.setWriteRasters(rasters);

        TIFFImage image = new TIFFImage();
        image.add(directory);
        TiffWriter.writeTiff(file.toFile(), image);
        log.debug("Wrote {}x{} raster {}", width, height, file.getFileName());
    }

    private static double[] doubles(FileDirectoryEntry entry) {
        if (entry == null || entry.getValues() == null) {
            return null;
        }
        Object values = entry.getValues();
        if (values instanceof Collection) {
            Collection<?> collection = (Collection<?>) values;
            double[] result = new double[collection.size()];
            int i = 0;
            for (Object value : collection) {
                result[i++] = ((Number) value).doubleValue();
            }
            return result;
        }
        if (values instanceof Number) {
            return new double[] {((Number) values).doubleValue()};
        }
        return null;
    }
}
