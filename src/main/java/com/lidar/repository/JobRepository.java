package com.lidar.repository;

import com.lidar.model.JobStatus;
import com.lidar.model.ProcessingJob;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Store of processing job records. Writes are visible to readers as soon as the call returns.
 */
public interface JobRepository {

    ProcessingJob save(ProcessingJob job);

    Optional<ProcessingJob> findById(String id);

    /**
     * Apply an update to the current record atomically and return the stored result
     *
     * @throws java.util.NoSuchElementException if the job does not exist
     */
    ProcessingJob update(String id, UnaryOperator<ProcessingJob> mutation);

    List<ProcessingJob> findByStatus(JobStatus status);
}
