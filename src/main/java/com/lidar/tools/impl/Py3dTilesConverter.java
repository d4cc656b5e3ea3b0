package com.lidar.tools.impl;

import com.lidar.config.LidarProperties;
import com.lidar.tools.ProcessRunner;
import com.lidar.tools.TilingConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Tile sets produced by the py3dtiles command line
 */
@Slf4j
@Component
public class Py3dTilesConverter implements TilingConverter {

    private final ProcessRunner processRunner;
    private final LidarProperties properties;

    public Py3dTilesConverter(ProcessRunner processRunner, LidarProperties properties) {
        this.processRunner = processRunner;
        this.properties = properties;
    }

    @Override
    public void convert(Path pointFile, Path outputDir, Duration timeout) {
        log.info("Converting {} to 3D Tiles (timeout {}s)", pointFile.getFileName(), timeout.toSeconds());
        processRunner.run(
                List.of(properties.getTools().getPy3dtilesExecutable(), "convert",
                        pointFile.toString(), "--out", outputDir.toString(), "--overwrite"),
                null,
                pointFile.getParent(),
                timeout);
    }
}
