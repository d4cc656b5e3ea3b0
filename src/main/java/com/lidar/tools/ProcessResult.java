package com.lidar.tools;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Exit status and captured output of a finished external command
 */
@Data
@AllArgsConstructor
public class ProcessResult {

    private int exitCode;
    private String stdout;
    private String stderr;

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
