package com.lidar.exception;

/**
 * No source tile intersects the requested area
 */
public class NoCoverageException extends LidarException {

    public NoCoverageException(String message) {
        super(message);
    }
}
