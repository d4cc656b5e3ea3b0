package com.lidar.segmentation;

import com.lidar.aspect.Timed;
import com.lidar.config.LidarProperties;
import com.lidar.model.DetectedTree;
import com.lidar.raster.GeoTiffRasterIO;
import com.lidar.raster.GeoTransform;
import com.lidar.raster.RasterGrid;
import com.lidar.tools.GeometryToolkit;
import com.lidar.tools.PointPipeline;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Individual tree detection from a cleaned point cloud: ground and highest-point
 * surfaces, canopy height model, tree tops, watershed crowns.
 */
@Slf4j
@Component
public class TreeSegmenter {

    static final String DTM_FILE = "dtm.tif";
    static final String DSM_FILE = "dsm.tif";
    static final String CHM_FILE = "chm.tif";

    private static final double SMOOTHING_SIGMA = 1.0;

    private final GeometryToolkit geometryToolkit;
    private final GeoTiffRasterIO rasterIO;
    private final GeometryFactory geometryFactory;
    private final LidarProperties properties;

    public TreeSegmenter(GeometryToolkit geometryToolkit, GeoTiffRasterIO rasterIO,
                         GeometryFactory geometryFactory, LidarProperties properties) {
        this.geometryToolkit = geometryToolkit;
        this.rasterIO = rasterIO;
        this.geometryFactory = geometryFactory;
        this.properties = properties;
    }

    /**
     * Build the surfaces for a point file in {@code workDir}, persist the canopy raster
     * next to them and segment it
     */
    @Timed(value = "segmentation.detect", logLevel = Timed.LogLevel.INFO)
    public List<DetectedTree> detectTrees(Path pointFile, Path workDir, TreeSegmentationParams params)
            throws IOException {
        double resolution = properties.getProcessing().getChmResolution();
        Path dtmFile = workDir.resolve(DTM_FILE);
        Path dsmFile = workDir.resolve(DSM_FILE);

        geometryToolkit.runPipeline(PointPipeline.groundSurface(pointFile, dtmFile, resolution), workDir);
        geometryToolkit.runPipeline(PointPipeline.highestSurface(pointFile, dsmFile, resolution), workDir);

        RasterGrid dtm = rasterIO.read(dtmFile, PointPipeline.NODATA);
        RasterGrid dsm = rasterIO.read(dsmFile, PointPipeline.NODATA);
        RasterGrid chm = CanopyHeightModel.compute(dsm, dtm);
        rasterIO.write(chm, workDir.resolve(CHM_FILE));

        return segment(chm, params);
    }

    /**
     * Trees of a canopy height raster, in tree-top order (highest first).
     * Crown diameter is that of a circle with the crown's area.
     */
    public List<DetectedTree> segment(RasterGrid chm, TreeSegmentationParams params) {
        GeoTransform transform = chm.getTransform();
        RasterGrid masked = CanopyHeightModel.threshold(chm, params.getMinHeight());
        RasterGrid smooth = GaussianSmoother.smooth(masked, SMOOTHING_SIGMA);

        int minDistance = Math.max(1, (int) (params.getSearchRadius() / transform.resolution()));
        List<Peak> peaks = PeakFinder.find(smooth, minDistance, params.getMinHeight());
        if (peaks.isEmpty()) {
            log.info("No canopy above {}m, no trees detected", params.getMinHeight());
            return new ArrayList<>();
        }

        int[] labels = WatershedSegmenter.segment(smooth, peaks);
        int[] pixelCounts = new int[peaks.size() + 1];
        for (int label : labels) {
            pixelCounts[label]++;
        }

        List<DetectedTree> trees = new ArrayList<>(peaks.size());
        for (int i = 0; i < peaks.size(); i++) {
            Peak peak = peaks.get(i);
            double crownArea = pixelCounts[i + 1] * transform.pixelArea();
            double crownDiameter = 2 * Math.sqrt(crownArea / Math.PI);
            float height = chm.isDefined(peak.getRow(), peak.getCol()) ? chm.get(peak.getRow(), peak.getCol()) : 0f;

            trees.add(DetectedTree.builder()
                    .id("tree_" + (i + 1))
                    .location(geometryFactory.createPoint(new Coordinate(
                            transform.columnToX(peak.getCol()), transform.rowToY(peak.getRow()))))
                    .height(round2(height))
                    .crownArea(round2(crownArea))
                    .crownDiameter(round2(crownDiameter))
                    .build());
        }
        log.info("Detected {} trees (minHeight={}m, searchRadius={}m)",
                trees.size(), params.getMinHeight(), params.getSearchRadius());
        return trees;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
