package com.lidar.exception;

import com.lidar.model.JobStatus;

/**
 * A status or progress update the job state machine does not allow
 */
public class IllegalJobTransitionException extends LidarException {

    public IllegalJobTransitionException(String jobId, JobStatus from, JobStatus to) {
        super(String.format("Job %s cannot move from %s to %s", jobId, from, to));
    }

    public IllegalJobTransitionException(String message) {
        super(message);
    }
}
