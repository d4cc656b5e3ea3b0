package com.lidar.service;

import com.lidar.model.JobSubmission;
import com.lidar.model.PipelineResult;
import com.lidar.model.ProcessingJob;

import java.util.Optional;

/**
 * Owns the job record state machine. Every method is one transition and rejects
 * moves the lattice does not allow with {@link com.lidar.exception.IllegalJobTransitionException}.
 */
public interface ProcessingJobService {

    /**
     * Create a pending job
     *
     * @throws com.lidar.exception.InvalidAreaException if an area is given but is not a valid polygon
     * @throws com.lidar.exception.InvalidJobRequestException if the source file is not .laz/.las or a tree
     *         threshold is out of range
     */
    ProcessingJob submit(JobSubmission submission);

    Optional<ProcessingJob> findById(String jobId);

    ProcessingJob markQueued(String jobId);

    ProcessingJob startProcessing(String jobId);

    /**
     * Record a phase checkpoint. Progress may not go backwards.
     */
    ProcessingJob advance(String jobId, int progress, String message);

    ProcessingJob complete(String jobId, PipelineResult result);

    /**
     * Move the job to failed, keeping its last progress value
     */
    ProcessingJob fail(String jobId, String errorMessage);
}
