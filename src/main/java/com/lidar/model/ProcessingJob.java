package com.lidar.model;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.locationtech.jts.geom.Geometry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tracking record of one processing request. Mutated only by the worker running it,
 * read by pollers.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcessingJob {

    private String id;

    private String tenantId;
    private String userId;

    /**
     * Parcel entity id in the digital-twin graph
     */
    private String parcelId;

    /**
     * Target area; null means the whole source file is processed
     */
    private Geometry area;

    /**
     * Local source file for uploaded-file jobs; null means resolve through the coverage index
     */
    private String sourceFile;

    @Builder.Default
    private JobConfig config = new JobConfig();

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Builder.Default
    private int progress = 0;

    private String statusMessage;
    private String errorMessage;

    // Results
    private String tilesetUrl;
    private Integer treeCount;
    private Long pointCount;

    @Builder.Default
    private List<DetectedTree> trees = new ArrayList<>();

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    @JsonIgnore
    public Optional<Geometry> findArea() {
        return Optional.ofNullable(area);
    }

    @JsonIgnore
    public Optional<String> findSourceFile() {
        return Optional.ofNullable(sourceFile).filter(s -> !s.isBlank());
    }
}
