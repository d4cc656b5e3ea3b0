package com.lidar.config;

import com.lidar.storage.ObjectStorage;
import com.lidar.storage.impl.LocalObjectStorage;
import com.lidar.storage.impl.S3ObjectStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Picks the object storage implementation from {@code lidar.storage.type}
 */
@Slf4j
@Configuration
public class StorageConfiguration {

    @Bean
    public ObjectStorage objectStorage(LidarProperties properties) {
        LidarProperties.Storage storage = properties.getStorage();
        if ("s3".equalsIgnoreCase(storage.getType())) {
            log.info("Using S3 object storage at {}", storage.getEndpoint());
            return new S3ObjectStorage(
                    S3ObjectStorage.createClient(storage.getEndpoint(), storage.getRegion(),
                            storage.getAccessKey(), storage.getSecretKey()),
                    storage.getEndpoint(), storage.getTilesetBucket(), storage.getPublicUrl());
        }
        if (!"local".equalsIgnoreCase(storage.getType())) {
            throw new IllegalStateException("Unknown storage type: " + storage.getType());
        }
        log.info("Using local object storage under {}", storage.getLocalRoot());
        return new LocalObjectStorage(Path.of(storage.getLocalRoot()));
    }
}
