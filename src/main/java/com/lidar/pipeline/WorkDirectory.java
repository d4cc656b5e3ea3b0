package com.lidar.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Private scratch directory of one job, deleted with everything in it on close
 */
@Slf4j
public class WorkDirectory implements AutoCloseable {

    private final Path path;

    private WorkDirectory(Path path) {
        this.path = path;
    }

    public static WorkDirectory create(Path root, String jobId) throws IOException {
        Files.createDirectories(root);
        return new WorkDirectory(Files.createTempDirectory(root, "job-" + jobId + "-"));
    }

    public Path path() {
        return path;
    }

    public Path resolve(String name) {
        return path.resolve(name);
    }

    @Override
    public void close() {
        if (!Files.exists(path)) {
            return;
        }
        try {
            List<Path> entries;
            try (Stream<Path> walk = Files.walk(path)) {
                entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            }
            for (Path entry : entries) {
                Files.deleteIfExists(entry);
            }
            log.debug("Removed work directory {}", path);
        } catch (IOException e) {
            // a leftover directory must not mask the job outcome
            log.warn("Could not remove work directory {}: {}", path, e.getMessage());
        }
    }
}
