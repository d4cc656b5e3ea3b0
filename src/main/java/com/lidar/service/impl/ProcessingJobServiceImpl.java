package com.lidar.service.impl;

import com.lidar.exception.IllegalJobTransitionException;
import com.lidar.exception.InvalidAreaException;
import com.lidar.exception.InvalidJobRequestException;
import com.lidar.model.JobConfig;
import com.lidar.model.JobStatus;
import com.lidar.model.JobSubmission;
import com.lidar.model.PipelineResult;
import com.lidar.model.ProcessingJob;
import com.lidar.repository.JobRepository;
import com.lidar.service.ProcessingJobService;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

@Service
public class ProcessingJobServiceImpl implements ProcessingJobService {

    private static final Logger logger = LoggerFactory.getLogger(ProcessingJobServiceImpl.class);

    @Autowired
    private JobRepository jobRepository;

    @Override
    public ProcessingJob submit(JobSubmission submission) {
        Geometry area = submission.getArea();
        if (area != null) {
            if (area.isEmpty()) {
                // an empty geometry means the same as no geometry
                area = null;
            } else if (area.getDimension() != 2 || !area.isValid()) {
                throw new InvalidAreaException("Area must be a valid polygon");
            }
        }

        String sourceFile = submission.getSourceFile();
        if (sourceFile != null && !isPointCloudFile(sourceFile)) {
            throw new InvalidJobRequestException("Source file must be a .laz or .las point cloud: " + sourceFile);
        }
        JobConfig config = submission.getConfig() != null ? submission.getConfig() : new JobConfig();
        validate(config);

        ProcessingJob job = ProcessingJob.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(submission.getTenantId())
                .userId(submission.getUserId())
                .parcelId(submission.getParcelId())
                .area(area)
                .sourceFile(sourceFile)
                .config(config)
                .status(JobStatus.PENDING)
                .progress(0)
                .statusMessage("Submitted")
                .createdAt(Instant.now())
                .build();

        logger.info("Submitted job {} (parcel={}, area={})", job.getId(), job.getParcelId(), area != null);
        return jobRepository.save(job);
    }

    @Override
    public Optional<ProcessingJob> findById(String jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    public ProcessingJob markQueued(String jobId) {
        return transition(jobId, JobStatus.QUEUED, job -> job.toBuilder()
                .status(JobStatus.QUEUED)
                .statusMessage("Queued")
                .build());
    }

    @Override
    public ProcessingJob startProcessing(String jobId) {
        return transition(jobId, JobStatus.PROCESSING, job -> job.toBuilder()
                .status(JobStatus.PROCESSING)
                .statusMessage("Processing started")
                .startedAt(job.getStartedAt() != null ? job.getStartedAt() : Instant.now())
                .build());
    }

    @Override
    public ProcessingJob advance(String jobId, int progress, String message) {
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("Progress out of range: " + progress);
        }
        return jobRepository.update(jobId, job -> {
            if (job.getStatus() != JobStatus.PROCESSING) {
                throw new IllegalJobTransitionException(String.format(
                    "Job %s is %s, progress can only be reported while processing", jobId, job.getStatus()));
            }
            if (progress < job.getProgress()) {
                throw new IllegalJobTransitionException(String.format(
                    "Job %s progress cannot go back from %d to %d", jobId, job.getProgress(), progress));
            }
            logger.info("Job {}: {}% {}", jobId, progress, message);
            return job.toBuilder()
                    .progress(progress)
                    .statusMessage(message)
                    .build();
        });
    }

    @Override
    public ProcessingJob complete(String jobId, PipelineResult result) {
        ProcessingJob completed = transition(jobId, JobStatus.COMPLETED, job -> job.toBuilder()
                .status(JobStatus.COMPLETED)
                .progress(100)
                .statusMessage("Completed")
                .tilesetUrl(result.getTilesetUrl())
                .pointCount(result.getPointCount())
                .treeCount(result.getTreeCount())
                .trees(result.getTrees() != null ? new ArrayList<>(result.getTrees()) : new ArrayList<>())
                .completedAt(Instant.now())
                .build());
        logger.info("Job {} completed: {} points, {} trees, tileset {}",
                jobId, result.getPointCount(), result.getTreeCount(), result.getTilesetUrl());
        return completed;
    }

    @Override
    public ProcessingJob fail(String jobId, String errorMessage) {
        String error = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        ProcessingJob failed = transition(jobId, JobStatus.FAILED, job -> job.toBuilder()
                .status(JobStatus.FAILED)
                .statusMessage("Failed")
                .errorMessage(error)
                .completedAt(Instant.now())
                .build());
        logger.warn("Job {} failed at {}%: {}", jobId, failed.getProgress(), error);
        return failed;
    }

    private ProcessingJob transition(String jobId, JobStatus target, UnaryOperator<ProcessingJob> change) {
        return jobRepository.update(jobId, job -> {
            if (!job.getStatus().canTransitionTo(target)) {
                throw new IllegalJobTransitionException(jobId, job.getStatus(), target);
            }
            return change.apply(job);
        });
    }

    private static boolean isPointCloudFile(String sourceFile) {
        String name = sourceFile.toLowerCase(Locale.ROOT);
        return name.endsWith(".laz") || name.endsWith(".las");
    }

    private static void validate(JobConfig config) {
        if (config.getTreeMinHeight() != null && !(config.getTreeMinHeight() >= 0)) {
            throw new InvalidJobRequestException("Tree minimum height must not be negative: " + config.getTreeMinHeight());
        }
        if (config.getTreeSearchRadius() != null && !(config.getTreeSearchRadius() > 0)) {
            throw new InvalidJobRequestException("Tree search radius must be positive: " + config.getTreeSearchRadius());
        }
    }
}
