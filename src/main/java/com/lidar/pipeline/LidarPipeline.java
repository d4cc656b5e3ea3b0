package com.lidar.pipeline;

import com.lidar.client.EntityGraphClient;
import com.lidar.config.LidarProperties;
import com.lidar.exception.ToolExecutionException;
import com.lidar.model.DetectedTree;
import com.lidar.model.JobConfig;
import com.lidar.model.PipelineResult;
import com.lidar.model.ProcessingJob;
import com.lidar.segmentation.TreeSegmentationParams;
import com.lidar.segmentation.TreeSegmenter;
import com.lidar.service.ProcessingJobService;
import com.lidar.service.TileCacheService;
import com.lidar.storage.ObjectStorage;
import com.lidar.storage.OriginFetcher;
import com.lidar.tools.GeometryToolkit;
import com.lidar.tools.PointPipeline;
import com.lidar.tools.TilingConverter;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One processing run of one job: ingest, spectral fusion, tree segmentation, tiling
 * and publish, strictly in that order. Each phase reports its checkpoint through the
 * job service before it starts; a failure anywhere fails the job and the work
 * directory is always removed.
 */
public class LidarPipeline {

    private static final Logger logger = LoggerFactory.getLogger(LidarPipeline.class);

    static final String CLEANED_FILE = "cleaned.laz";
    static final String COLORIZED_FILE = "colorized.laz";
    static final String NDVI_FILE = "ndvi.tif";
    static final String TILES_DIR = "tiles";
    static final String TILESET_PREFIX = "tilesets/";

    private final ProcessingJobService jobService;
    private final TileCacheService tileCacheService;
    private final GeometryToolkit geometryToolkit;
    private final TilingConverter tilingConverter;
    private final TreeSegmenter treeSegmenter;
    private final ObjectStorage objectStorage;
    private final OriginFetcher originFetcher;
    private final EntityGraphClient entityGraphClient;
    private final LidarProperties properties;

    private String jobId;
    private Deadline deadline;

    LidarPipeline(ProcessingJobService jobService, TileCacheService tileCacheService,
                  GeometryToolkit geometryToolkit, TilingConverter tilingConverter,
                  TreeSegmenter treeSegmenter, ObjectStorage objectStorage,
                  OriginFetcher originFetcher, EntityGraphClient entityGraphClient,
                  LidarProperties properties) {
        this.jobService = jobService;
        this.tileCacheService = tileCacheService;
        this.geometryToolkit = geometryToolkit;
        this.tilingConverter = tilingConverter;
        this.treeSegmenter = treeSegmenter;
        this.objectStorage = objectStorage;
        this.originFetcher = originFetcher;
        this.entityGraphClient = entityGraphClient;
        this.properties = properties;
    }

    /**
     * Process a job to completion
     *
     * @param tileLocator download locator of the source tile, or null to read the job's own source file
     * @throws IOException on download, storage or raster I/O failure; the job is marked failed first
     */
    public PipelineResult execute(ProcessingJob job, String tileLocator) throws IOException {
        if (this.jobId != null) {
            throw new IllegalStateException("Pipeline already used for job " + this.jobId);
        }
        this.jobId = job.getId();
        this.deadline = Deadline.after(properties.getProcessing().getJobTimeout());

        ProcessingJob current = jobService.startProcessing(jobId);
        logger.info("Processing job {} (source={})", jobId,
                tileLocator != null ? tileLocator : current.getSourceFile());

        try (WorkDirectory workDir = WorkDirectory.create(Path.of(properties.getWorkDirRoot()), jobId)) {
            Path cleaned = ingest(current, tileLocator, workDir);
            Path colored = fuse(current.getConfig(), cleaned, workDir);
            List<DetectedTree> trees = segment(current.getConfig(), cleaned, workDir);
            Path tilesDir = tile(colored, workDir);
            PipelineResult result = publish(colored, tilesDir, trees);

            enter(PipelinePhase.ENTITY_GRAPH);
            entityGraphClient.publishResult(current, result);

            jobService.complete(jobId, result);
            return result;
        } catch (IOException | RuntimeException e) {
            logger.error("Job {} failed", jobId, e);
            try {
                jobService.fail(jobId, describe(e));
            } catch (RuntimeException recordFailure) {
                e.addSuppressed(recordFailure);
            }
            throw e;
        }
    }

    Path ingest(ProcessingJob job, String tileLocator, WorkDirectory workDir) throws IOException {
        enter(PipelinePhase.INGEST);
        Path source = tileLocator != null
                ? tileCacheService.resolveLocalFile(tileLocator, workDir.path())
                : job.findSourceFile().map(Path::of).orElseThrow(() ->
                        new IllegalStateException("Job " + jobId + " has neither a tile nor a source file"));
        if (!Files.isRegularFile(source)) {
            throw new IOException("Source file not found: " + source);
        }

        String areaWkt = job.findArea().map(Geometry::toText).orElse(null);
        if (areaWkt == null) {
            logger.info("Job {} has no area, processing the whole file", jobId);
        }
        Path cleaned = workDir.resolve(CLEANED_FILE);
        geometryToolkit.runPipeline(PointPipeline.ingest(source, cleaned, areaWkt), workDir.path());
        requireOutput(cleaned, "point cleaning");
        return cleaned;
    }

    Path fuse(JobConfig config, Path cleaned, WorkDirectory workDir) throws IOException {
        enter(PipelinePhase.SPECTRAL_FUSION);
        if (!config.wantsSpectralFusion()) {
            logger.debug("Job {} has no spectral fusion, keeping cleaned file", jobId);
            return cleaned;
        }

        Path raster = workDir.resolve(NDVI_FILE);
        originFetcher.fetch(config.getNdviSourceUrl(), raster, properties.getDownload().getRasterTimeout());
        Path colored = workDir.resolve(COLORIZED_FILE);
        geometryToolkit.runPipeline(PointPipeline.colorize(cleaned, raster, colored), workDir.path());
        requireOutput(colored, "spectral fusion");
        return colored;
    }

    List<DetectedTree> segment(JobConfig config, Path cleaned, WorkDirectory workDir) throws IOException {
        enter(PipelinePhase.TREE_SEGMENTATION);
        if (!config.isDetectTrees()) {
            return new ArrayList<>();
        }
        LidarProperties.Processing defaults = properties.getProcessing();
        TreeSegmentationParams params = new TreeSegmentationParams(
                config.getTreeMinHeight() != null ? config.getTreeMinHeight() : defaults.getDefaultTreeMinHeight(),
                config.getTreeSearchRadius() != null ? config.getTreeSearchRadius() : defaults.getDefaultTreeSearchRadius());
        return treeSegmenter.detectTrees(cleaned, workDir.path(), params);
    }

    Path tile(Path pointFile, WorkDirectory workDir) throws IOException {
        enter(PipelinePhase.TILING);
        Path tilesDir = workDir.resolve(TILES_DIR);
        Files.createDirectories(tilesDir);

        tilingConverter.convert(pointFile, tilesDir,
                deadline.cap(properties.getProcessing().getTilingTimeout(), PipelinePhase.TILING));
        if (!Files.isRegularFile(tilesDir.resolve(TilingConverter.MANIFEST))) {
            throw new ToolExecutionException("Tiling finished without producing " + TilingConverter.MANIFEST);
        }
        return tilesDir;
    }

    PipelineResult publish(Path pointFile, Path tilesDir, List<DetectedTree> trees) throws IOException {
        enter(PipelinePhase.PUBLISH);
        String bucket = properties.getStorage().getTilesetBucket();
        String prefix = TILESET_PREFIX + jobId;

        int uploaded = objectStorage.uploadDirectory(bucket, prefix, tilesDir);
        logger.info("Uploaded {} tile files for job {} to {}/{}", uploaded, jobId, bucket, prefix);

        return PipelineResult.builder()
                .tilesetUrl(objectStorage.publicUrl(bucket, prefix + "/" + TilingConverter.MANIFEST))
                .pointCount(geometryToolkit.pointCount(pointFile))
                .trees(trees)
                .build();
    }

    private void enter(PipelinePhase phase) {
        deadline.check(phase);
        jobService.advance(jobId, phase.getProgress(), phase.getMessage());
    }

    private static void requireOutput(Path file, String step) {
        if (!Files.isRegularFile(file)) {
            throw new ToolExecutionException(step + " produced no output file " + file.getFileName());
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
