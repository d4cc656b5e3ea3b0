package com.lidar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * LiDAR processing service: coverage lookup, source tile caching,
 * point-cloud cleaning, tree segmentation and 3D tiling.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LidarApplication {
    public static void main(String[] args) {
        SpringApplication.run(LidarApplication.class, args);
    }
}
