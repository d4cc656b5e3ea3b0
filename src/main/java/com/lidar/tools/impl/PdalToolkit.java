package com.lidar.tools.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lidar.config.LidarProperties;
import com.lidar.exception.ToolExecutionException;
import com.lidar.tools.GeometryToolkit;
import com.lidar.tools.PointPipeline;
import com.lidar.tools.ProcessResult;
import com.lidar.tools.ProcessRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * PDAL command-line toolkit
 */
@Slf4j
@Component
public class PdalToolkit implements GeometryToolkit {

    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;
    private final LidarProperties properties;

    public PdalToolkit(ProcessRunner processRunner, ObjectMapper objectMapper, LidarProperties properties) {
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void runPipeline(PointPipeline pipeline, Path workDir) {
        log.info("Running PDAL pipeline {}", pipeline.stageTypes());
        processRunner.run(
                List.of(properties.getTools().getPdalExecutable(), "pipeline", "--stdin"),
                pipeline.toJson(objectMapper),
                workDir,
                properties.getTools().getToolTimeout());
    }

    @Override
    public long pointCount(Path pointFile) {
        ProcessResult result = processRunner.run(
                List.of(properties.getTools().getPdalExecutable(), "info", "--metadata", pointFile.toString()),
                null,
                pointFile.getParent(),
                properties.getTools().getToolTimeout());
        try {
            JsonNode count = objectMapper.readTree(result.getStdout()).path("metadata").path("count");
            if (!count.canConvertToLong()) {
                throw new ToolExecutionException("pdal info reported no point count for " + pointFile);
            }
            return count.asLong();
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException("Unreadable pdal info output: " + e.getOriginalMessage(), e);
        }
    }
}
