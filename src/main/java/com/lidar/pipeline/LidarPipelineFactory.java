package com.lidar.pipeline;

import com.lidar.client.EntityGraphClient;
import com.lidar.config.LidarProperties;
import com.lidar.segmentation.TreeSegmenter;
import com.lidar.service.ProcessingJobService;
import com.lidar.service.TileCacheService;
import com.lidar.storage.ObjectStorage;
import com.lidar.storage.OriginFetcher;
import com.lidar.tools.GeometryToolkit;
import com.lidar.tools.TilingConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Creates a fresh pipeline per job over the shared collaborators
 */
@Component
@RequiredArgsConstructor
public class LidarPipelineFactory {

    private final ProcessingJobService jobService;
    private final TileCacheService tileCacheService;
    private final GeometryToolkit geometryToolkit;
    private final TilingConverter tilingConverter;
    private final TreeSegmenter treeSegmenter;
    private final ObjectStorage objectStorage;
    private final OriginFetcher originFetcher;
    private final EntityGraphClient entityGraphClient;
    private final LidarProperties properties;

    public LidarPipeline create() {
        return new LidarPipeline(jobService, tileCacheService, geometryToolkit, tilingConverter,
                treeSegmenter, objectStorage, originFetcher, entityGraphClient, properties);
    }
}
