package com.lidar.repository.impl;

import com.lidar.model.DetectedTree;
import com.lidar.model.JobConfig;
import com.lidar.model.JobStatus;
import com.lidar.model.ProcessingJob;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobRepositoryTest {

    private final GeometryFactory geometryFactory = new GeometryFactory();
    private final InMemoryJobRepository repository = new InMemoryJobRepository();

    @Test
    void testEditsToAPolledJobDoNotReachTheStore() {
        // Given
        repository.save(ProcessingJob.builder()
            .id("job-1")
            .status(JobStatus.PROCESSING)
            .area(geometryFactory.toGeometry(new Envelope(0, 10, 0, 10)))
            .config(JobConfig.builder().detectTrees(false).build())
            .build());

        // When
        ProcessingJob polled = repository.findById("job-1").orElseThrow();
        polled.getConfig().setDetectTrees(true);
        polled.getTrees().add(DetectedTree.builder().id("tree_1").height(4.0).build());
        polled.getArea().getCoordinates()[0].setX(-50);

        // Then
        ProcessingJob stored = repository.findById("job-1").orElseThrow();
        assertFalse(stored.getConfig().isDetectTrees());
        assertTrue(stored.getTrees().isEmpty());
        assertEquals(0.0, stored.getArea().getEnvelopeInternal().getMinX());
    }

    @Test
    void testSavedTreesAreCopied() {
        DetectedTree tree = DetectedTree.builder()
            .id("tree_1")
            .location(geometryFactory.createPoint(new Coordinate(1, 2)))
            .height(6.5)
            .build();
        ProcessingJob job = ProcessingJob.builder().id("job-2").status(JobStatus.COMPLETED).build();
        job.getTrees().add(tree);
        repository.save(job);

        tree.setHeight(99);
        repository.findById("job-2").orElseThrow().getTrees().get(0).setHeight(42);

        assertEquals(6.5, repository.findById("job-2").orElseThrow().getTrees().get(0).getHeight());
    }

    @Test
    void testUpdateOfUnknownJobFails() {
        assertThrows(NoSuchElementException.class, () -> repository.update("missing", job -> job));
    }
}
