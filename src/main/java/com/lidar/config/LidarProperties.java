package com.lidar.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from the {@code lidar.*} namespace of application.yml
 */
@Data
@ConfigurationProperties(prefix = "lidar")
public class LidarProperties {

    /**
     * Root under which each job gets its own private working directory
     */
    private String workDirRoot = System.getProperty("java.io.tmpdir") + "/lidar";

    private Processing processing = new Processing();
    private Worker worker = new Worker();
    private Tools tools = new Tools();
    private Storage storage = new Storage();
    private Download download = new Download();
    private EntityGraph entityGraph = new EntityGraph();
    private Coverage coverage = new Coverage();

    @Data
    public static class Processing {
        private double defaultTreeMinHeight = 2.0;
        private double defaultTreeSearchRadius = 3.0;
        private double chmResolution = 0.5;
        // Wall-clock budget for a whole job
        private Duration jobTimeout = Duration.ofMinutes(30);
        private Duration tilingTimeout = Duration.ofMinutes(30);
    }

    @Data
    public static class Worker {
        private int poolSize = 4;
        private int queueCapacity = 100;
    }

    @Data
    public static class Tools {
        private String pdalExecutable = "pdal";
        private String py3dtilesExecutable = "py3dtiles";
        private Duration toolTimeout = Duration.ofMinutes(20);
    }

    @Data
    public static class Storage {
        /**
         * {@code local} or {@code s3}
         */
        private String type = "local";
        private String localRoot = System.getProperty("java.io.tmpdir") + "/lidar-storage";
        private String endpoint = "http://minio:9000";
        private String accessKey = "minioadmin";
        private String secretKey = "minioadmin";
        private String region = "us-east-1";
        private String tilesetBucket = "lidar-tilesets";
        private String sourceTilesBucket = "lidar-source-tiles";
        private String publicUrl = "http://localhost:9000/lidar-tilesets";
    }

    @Data
    public static class Download {
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration tileTimeout = Duration.ofMinutes(10);
        private Duration rasterTimeout = Duration.ofMinutes(2);
    }

    @Data
    public static class EntityGraph {
        private boolean enabled = false;
        private String url = "http://orion-ld:1026";
        private int treeBatchLimit = 100;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Coverage {
        /**
         * Optional GeoJSON file imported into the coverage index at startup
         */
        private String seedFile;
        private String seedSource = "PNOA";
        private boolean seedClearExisting = false;
    }
}
