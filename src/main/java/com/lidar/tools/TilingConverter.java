package com.lidar.tools;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Converts a point file into a hierarchical 3D tile set rooted at {@code tileset.json}
 */
public interface TilingConverter {

    String MANIFEST = "tileset.json";

    /**
     * @throws com.lidar.exception.ToolExecutionException on non-zero exit or timeout
     */
    void convert(Path pointFile, Path outputDir, Duration timeout);
}
