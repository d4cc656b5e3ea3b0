package com.lidar.tools;

import java.nio.file.Path;

/**
 * Point-cloud processing toolkit driven by declarative pipelines
 */
public interface GeometryToolkit {

    /**
     * Run the pipeline to completion
     *
     * @throws com.lidar.exception.ToolExecutionException if the toolkit reports a failure
     */
    void runPipeline(PointPipeline pipeline, Path workDir);

    /**
     * Number of points in a point file, from the toolkit's metadata read
     */
    long pointCount(Path pointFile);
}
