package com.lidar.pipeline;

/**
 * Phases of a processing run in execution order, with the progress reported on entry
 */
public enum PipelinePhase {
    INGEST(10, "Ingesting point cloud"),
    SPECTRAL_FUSION(30, "Applying spectral fusion"),
    TREE_SEGMENTATION(50, "Detecting trees"),
    TILING(70, "Generating 3D tiles"),
    PUBLISH(90, "Publishing tile set"),
    ENTITY_GRAPH(95, "Updating digital twin");

    private final int progress;
    private final String message;

    PipelinePhase(int progress, String message) {
        this.progress = progress;
        this.message = message;
    }

    public int getProgress() {
        return progress;
    }

    public String getMessage() {
        return message;
    }
}
