package com.lidar.pipeline;

import com.lidar.exception.IllegalJobTransitionException;
import com.lidar.exception.NoCoverageException;
import com.lidar.model.JobStatus;
import com.lidar.model.ProcessingJob;
import com.lidar.model.SourceTile;
import com.lidar.service.CoverageService;
import com.lidar.service.ProcessingJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;

/**
 * Schedules jobs on the worker pool. A job picks its source tile from the coverage index
 * (or uses its uploaded file) and runs through a fresh pipeline. Jobs can be cancelled
 * only while they wait in the queue.
 */
@Component
public class LidarJobRunner {

    private static final Logger logger = LoggerFactory.getLogger(LidarJobRunner.class);

    static final String CANCELLED_MESSAGE = "Cancelled before processing started";

    private final ProcessingJobService jobService;
    private final CoverageService coverageService;
    private final LidarPipelineFactory pipelineFactory;
    private final AsyncTaskExecutor executor;

    private final Map<String, Future<ProcessingJob>> scheduled = new ConcurrentHashMap<>();
    private final Set<String> waiting = ConcurrentHashMap.newKeySet();

    public LidarJobRunner(ProcessingJobService jobService, CoverageService coverageService,
                          LidarPipelineFactory pipelineFactory,
                          @Qualifier("pipelineExecutor") AsyncTaskExecutor executor) {
        this.jobService = jobService;
        this.coverageService = coverageService;
        this.pipelineFactory = pipelineFactory;
        this.executor = executor;
    }

    /**
     * Queue a pending job for processing
     *
     * @return future of the finished job record; it fails with the job's error
     */
    public Future<ProcessingJob> enqueue(String jobId) {
        jobService.markQueued(jobId);
        waiting.add(jobId);
        FutureTask<ProcessingJob> task = new FutureTask<>(() -> {
            try {
                // lost the claim to cancel()
                if (!waiting.remove(jobId)) {
                    return jobService.findById(jobId).orElseThrow();
                }
                return process(jobId);
            } finally {
                scheduled.remove(jobId);
            }
        });
        scheduled.put(jobId, task);
        try {
            executor.execute(task);
        } catch (TaskRejectedException e) {
            scheduled.remove(jobId);
            waiting.remove(jobId);
            jobService.fail(jobId, "Worker queue is full");
            throw e;
        }
        logger.info("Queued job {}", jobId);
        return task;
    }

    /**
     * Withdraw a queued job that has not started yet
     *
     * @return true if the job will not run
     */
    public boolean cancel(String jobId) {
        if (!waiting.remove(jobId)) {
            logger.info("Job {} is not waiting in the queue, cannot cancel", jobId);
            return false;
        }
        Future<ProcessingJob> future = scheduled.remove(jobId);
        if (future != null) {
            future.cancel(false);
        }
        jobService.fail(jobId, CANCELLED_MESSAGE);
        logger.info("Cancelled job {}", jobId);
        return true;
    }

    /**
     * Run a job on the calling thread
     */
    public ProcessingJob process(String jobId) throws IOException {
        ProcessingJob job = jobService.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job " + jobId));
        if (!job.getStatus().canTransitionTo(JobStatus.PROCESSING)) {
            throw new IllegalJobTransitionException("Job " + jobId + " is already " + job.getStatus());
        }

        try {
            if (job.findSourceFile().isPresent()) {
                pipelineFactory.create().execute(job, null);
            } else {
                SourceTile tile = resolveTile(job);
                logger.info("Job {} uses tile {} ({}, {}, {} pts/m2)", jobId, tile.getTileName(),
                        tile.getSource(), tile.getFlightYear(), tile.getPointDensity());
                pipelineFactory.create().execute(job, tile.getLazUrl());
            }
        } finally {
            job.findSourceFile().ifPresent(this::deleteUpload);
        }
        return jobService.findById(jobId).orElseThrow();
    }

    private SourceTile resolveTile(ProcessingJob job) {
        try {
            if (job.findArea().isEmpty()) {
                throw new NoCoverageException("Job has neither an area nor a source file");
            }
            return coverageService.bestTile(job.getArea(), job.getConfig().getSource())
                    .orElseThrow(() -> new NoCoverageException("No LiDAR coverage for the requested area"));
        } catch (RuntimeException e) {
            jobService.fail(job.getId(), e.getMessage());
            throw e;
        }
    }

    private void deleteUpload(String sourceFile) {
        try {
            if (Files.deleteIfExists(Path.of(sourceFile))) {
                logger.debug("Removed uploaded file {}", sourceFile);
            }
        } catch (IOException e) {
            logger.warn("Could not remove uploaded file {}: {}", sourceFile, e.getMessage());
        }
    }
}
