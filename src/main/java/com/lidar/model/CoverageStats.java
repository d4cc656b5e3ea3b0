package com.lidar.model;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Tile counts of the coverage index, overall and per source label
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoverageStats {

    private long totalTiles;

    private Map<String, Long> tilesBySource;
}
