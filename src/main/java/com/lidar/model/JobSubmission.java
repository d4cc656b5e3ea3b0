package com.lidar.model;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Geometry;

/**
 * What the submission collaborator hands over to create a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmission {

    private String tenantId;
    private String userId;
    private String parcelId;

    /**
     * WKT or GeoJSON on the wire; absent for whole-file processing
     */
    private Geometry area;

    private String sourceFile;

    private JobConfig config;
}
