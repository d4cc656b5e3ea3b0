package com.lidar.model;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a completed pipeline run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineResult {

    private String tilesetUrl;
    private long pointCount;

    @Builder.Default
    private List<DetectedTree> trees = new ArrayList<>();

    public int getTreeCount() {
        return trees == null ? 0 : trees.size();
    }
}
