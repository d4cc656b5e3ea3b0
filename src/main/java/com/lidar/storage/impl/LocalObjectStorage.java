package com.lidar.storage.impl;

import com.lidar.storage.ObjectStorage;
import lombok.extern.slf4j.Slf4j;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Object storage on the local filesystem; each bucket is a directory under the root
 */
@Slf4j
public class LocalObjectStorage implements ObjectStorage {

    private final Path root;

    public LocalObjectStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void putFile(String bucket, String key, Path file, String contentType) throws IOException {
        Path target = resolve(bucket, key);
        Files.createDirectories(target.getParent());
        Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Stored {} as {}/{}", file.getFileName(), bucket, key);
    }

    @Override
    public Path getFile(String bucket, String key, Path target) throws IOException {
        Path source = resolve(bucket, key);
        if (!Files.isRegularFile(source)) {
            throw new FileNotFoundException("No object " + bucket + "/" + key);
        }
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        return Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    public boolean exists(String bucket, String key) {
        return Files.isRegularFile(resolve(bucket, key));
    }

    @Override
    public int deletePrefix(String bucket, String prefix) throws IOException {
        Path bucketDir = root.resolve(bucket);
        if (!Files.isDirectory(bucketDir)) {
            return 0;
        }
        List<Path> doomed;
        try (Stream<Path> walk = Files.walk(bucketDir)) {
            doomed = walk.filter(Files::isRegularFile)
                    .filter(p -> bucketDir.relativize(p).toString().replace('\\', '/').startsWith(prefix))
                    .collect(Collectors.toList());
        }
        for (Path path : doomed) {
            Files.delete(path);
        }
        pruneEmptyDirectories(bucketDir);
        return doomed.size();
    }

    @Override
    public String publicUrl(String bucket, String key) {
        return resolve(bucket, key).toUri().toString();
    }

    private Path resolve(String bucket, String key) {
        Path path = root.resolve(bucket).resolve(key).normalize();
        if (!path.startsWith(root.resolve(bucket))) {
            throw new IllegalArgumentException("Key escapes bucket: " + key);
        }
        return path;
    }

    private void pruneEmptyDirectories(Path bucketDir) throws IOException {
        List<Path> dirs;
        try (Stream<Path> walk = Files.walk(bucketDir)) {
            dirs = walk.filter(Files::isDirectory)
                    .filter(p -> !p.equals(bucketDir))
                    .sorted(Comparator.reverseOrder())
                    .collect(Collectors.toList());
        }
        for (Path dir : dirs) {
            try (Stream<Path> entries = Files.list(dir)) {
                if (entries.findAny().isEmpty()) {
                    Files.delete(dir);
                }
            }
        }
    }
}
