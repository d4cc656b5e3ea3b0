package com.lidar.exception;

/**
 * Root of the processing service's unchecked exceptions
 */
public class LidarException extends RuntimeException {

    public LidarException(String message) {
        super(message);
    }

    public LidarException(String message, Throwable cause) {
        super(message, cause);
    }
}
