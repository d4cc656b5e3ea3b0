package com.lidar.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Key-prefixed blob store holding cached source tiles and published tile sets
 */
public interface ObjectStorage {

    void putFile(String bucket, String key, Path file, String contentType) throws IOException;

    /**
     * Copy an object to a local file, replacing it if present
     *
     * @throws java.io.FileNotFoundException if the object does not exist
     */
    Path getFile(String bucket, String key, Path target) throws IOException;

    boolean exists(String bucket, String key) throws IOException;

    /**
     * @return number of objects removed
     */
    int deletePrefix(String bucket, String prefix) throws IOException;

    /**
     * Stable locator of a stored object, usable by a web client
     */
    String publicUrl(String bucket, String key);

    /**
     * Upload every regular file under {@code directory} keeping its relative path below {@code prefix}
     *
     * @return number of files uploaded
     */
    default int uploadDirectory(String bucket, String prefix, Path directory) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        for (Path file : files) {
            String relative = directory.relativize(file).toString().replace('\\', '/');
            putFile(bucket, prefix + "/" + relative, file, ContentTypes.forFileName(relative));
        }
        return files.size();
    }
}
