package com.lidar.support;

import com.lidar.exception.ToolExecutionException;
import com.lidar.tools.TilingConverter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Writes a minimal tile set, or nothing when told to skip the manifest
 */
public class FakeTilingConverter implements TilingConverter {

    private final boolean writeManifest;

    public FakeTilingConverter(boolean writeManifest) {
        this.writeManifest = writeManifest;
    }

    @Override
    public void convert(Path pointFile, Path outputDir, Duration timeout) {
        try {
            Files.createDirectories(outputDir.resolve("r"));
            Files.writeString(outputDir.resolve("r/r0.pnts"), "pnts");
            if (writeManifest) {
                Files.writeString(outputDir.resolve(MANIFEST),
                        "{\"asset\":{\"version\":\"1.0\"},\"root\":{\"content\":{\"uri\":\"r/r0.pnts\"}}}");
            }
        } catch (IOException e) {
            throw new ToolExecutionException("fake converter failed: " + e.getMessage(), e);
        }
    }
}
