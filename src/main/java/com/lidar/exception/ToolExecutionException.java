package com.lidar.exception;

/**
 * An external geometry or tiling tool exited non-zero, timed out or did not produce its output
 */
public class ToolExecutionException extends LidarException {

    private final int exitCode;

    public ToolExecutionException(String message) {
        this(message, -1);
    }

    public ToolExecutionException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public int getExitCode() {
        return exitCode;
    }
}
