package com.lidar.exception;

/**
 * A job ran past its wall-clock budget
 */
public class JobTimeoutException extends LidarException {

    public JobTimeoutException(String message) {
        super(message);
    }
}
