package com.lidar.pipeline;

import com.lidar.exception.IllegalJobTransitionException;
import com.lidar.exception.NoCoverageException;
import com.lidar.model.JobConfig;
import com.lidar.model.JobStatus;
import com.lidar.model.JobSubmission;
import com.lidar.model.ProcessingJob;
import com.lidar.model.SourceTile;
import com.lidar.repository.impl.InMemoryCoverageRepository;
import com.lidar.repository.impl.InMemoryJobRepository;
import com.lidar.service.impl.CoverageServiceImpl;
import com.lidar.service.impl.ProcessingJobServiceImpl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class LidarJobRunnerTest {

    @TempDir
    Path tempDir;

    private final GeometryFactory geometryFactory = new GeometryFactory();

    private ProcessingJobServiceImpl jobService;
    private CoverageServiceImpl coverageService;
    private LidarPipelineFactory pipelineFactory;
    private LidarPipeline pipeline;
    private ThreadPoolTaskExecutor executor;
    private LidarJobRunner runner;

    @BeforeEach
    void setUp() {
        jobService = new ProcessingJobServiceImpl();
        ReflectionTestUtils.setField(jobService, "jobRepository", new InMemoryJobRepository());

        coverageService = new CoverageServiceImpl();
        ReflectionTestUtils.setField(coverageService, "coverageRepository", new InMemoryCoverageRepository());
        ReflectionTestUtils.setField(coverageService, "geometryFactory", geometryFactory);
        coverageService.seed("PNOA", List.of(
            tile("PNOA_2022_NAV_610-4740", 2022, 2.0),
            tile("PNOA_2023_NAV_610-4740", 2023, 4.0)), false);

        pipelineFactory = mock(LidarPipelineFactory.class);
        pipeline = mock(LidarPipeline.class);
        when(pipelineFactory.create()).thenReturn(pipeline);

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(10);
        executor.initialize();

        runner = new LidarJobRunner(jobService, coverageService, pipelineFactory, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void testPicksNewestDensestTile() throws Exception {
        // Given
        String jobId = submit(box(1, 1, 2, 2), null).getId();

        // When
        runner.process(jobId);

        // Then
        verify(pipeline).execute(argThat(job -> jobId.equals(job.getId())),
            eq("https://example.org/PNOA_2023_NAV_610-4740.laz"));
    }

    @Test
    void testNoCoverageFailsJob() {
        String jobId = submit(box(50, 50, 51, 51), null).getId();

        assertThrows(NoCoverageException.class, () -> runner.process(jobId));

        ProcessingJob failed = jobService.findById(jobId).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.getStatus());
        assertEquals("No LiDAR coverage for the requested area", failed.getErrorMessage());
        verify(pipelineFactory, never()).create();
    }

    @Test
    void testUploadedFileIsProcessedAndRemoved() throws Exception {
        // Given
        Path upload = Files.writeString(tempDir.resolve("upload.laz"), "points");
        String jobId = submit(null, upload.toString()).getId();

        // When
        runner.process(jobId);

        // Then
        verify(pipeline).execute(any(ProcessingJob.class), isNull());
        assertFalse(Files.exists(upload));
    }

    @Test
    void testTerminalJobIsNotReprocessed() {
        String jobId = submit(box(1, 1, 2, 2), null).getId();
        jobService.fail(jobId, "gone");

        assertThrows(IllegalJobTransitionException.class, () -> runner.process(jobId));
    }

    @Test
    void testRunningJobKeepsItsUpload() throws Exception {
        Path upload = Files.writeString(tempDir.resolve("running.laz"), "points");
        String jobId = submit(null, upload.toString()).getId();
        jobService.startProcessing(jobId);

        assertThrows(IllegalJobTransitionException.class, () -> runner.process(jobId));
        verify(pipeline, never()).execute(any(ProcessingJob.class), any());
        assertTrue(Files.exists(upload));
    }

    @Test
    void testCancelOnlyWhileWaiting() throws Exception {
        // Given a worker busy with the first job
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        String first = submit(box(1, 1, 2, 2), null).getId();
        String second = submit(box(1, 1, 2, 2), null).getId();
        doAnswer(invocation -> {
            started.countDown();
            assertTrue(release.await(10, TimeUnit.SECONDS));
            return null;
        }).when(pipeline).execute(any(ProcessingJob.class), any());

        Future<ProcessingJob> running = runner.enqueue(first);
        assertTrue(started.await(10, TimeUnit.SECONDS));
        runner.enqueue(second);

        // When
        boolean cancelledRunning = runner.cancel(first);
        boolean cancelledWaiting = runner.cancel(second);
        release.countDown();
        running.get(10, TimeUnit.SECONDS);

        // Then
        assertFalse(cancelledRunning);
        assertTrue(cancelledWaiting);
        ProcessingJob cancelled = jobService.findById(second).orElseThrow();
        assertEquals(JobStatus.FAILED, cancelled.getStatus());
        assertEquals(LidarJobRunner.CANCELLED_MESSAGE, cancelled.getErrorMessage());
        verify(pipeline, times(1)).execute(any(ProcessingJob.class), any());
        assertFalse(runner.cancel(second));
    }

    private ProcessingJob submit(Geometry area, String sourceFile) {
        return jobService.submit(JobSubmission.builder()
            .tenantId("farm")
            .area(area)
            .sourceFile(sourceFile)
            .config(JobConfig.builder().source("PNOA").build())
            .build());
    }

    private Geometry box(double minX, double minY, double maxX, double maxY) {
        return geometryFactory.toGeometry(new Envelope(minX, maxX, minY, maxY));
    }

    private SourceTile tile(String name, Integer year, Double density) {
        return SourceTile.builder()
            .id(name)
            .flightYear(year)
            .pointDensity(density)
            .lazUrl("https://example.org/" + name + ".laz")
            .geometry(box(0, 0, 10, 10))
            .build();
    }
}
