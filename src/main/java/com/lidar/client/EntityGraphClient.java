package com.lidar.client;

import com.lidar.model.PipelineResult;
import com.lidar.model.ProcessingJob;

/**
 * Downstream digital-twin bookkeeping for finished jobs. Calls are best-effort:
 * implementations log failures and never throw.
 */
public interface EntityGraphClient {

    void publishResult(ProcessingJob job, PipelineResult result);
}
