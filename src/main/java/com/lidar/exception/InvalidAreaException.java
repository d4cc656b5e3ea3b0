package com.lidar.exception;

/**
 * Area geometry that cannot be parsed or is not a valid polygon
 */
public class InvalidAreaException extends LidarException {

    public InvalidAreaException(String message) {
        super(message);
    }

    public InvalidAreaException(String message, Throwable cause) {
        super(message, cause);
    }
}
