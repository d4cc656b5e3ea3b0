package com.lidar.exception;

/**
 * Submission with an unusable source file or processing option
 */
public class InvalidJobRequestException extends LidarException {

    public InvalidJobRequestException(String message) {
        super(message);
    }
}
