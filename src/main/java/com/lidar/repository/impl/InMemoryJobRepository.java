package com.lidar.repository.impl;

import com.lidar.model.DetectedTree;
import com.lidar.model.JobStatus;
import com.lidar.model.ProcessingJob;
import com.lidar.repository.JobRepository;

import org.locationtech.jts.geom.Point;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Job records in a concurrent map. Callers always receive deep copies, so a record handed
 * to a poller never changes underneath it and edits to it never reach the stored record.
 */
@Repository
public class InMemoryJobRepository implements JobRepository {

    private final Map<String, ProcessingJob> jobs = new ConcurrentHashMap<>();

    @Override
    public ProcessingJob save(ProcessingJob job) {
        jobs.put(job.getId(), copy(job));
        return copy(job);
    }

    @Override
    public Optional<ProcessingJob> findById(String id) {
        return Optional.ofNullable(jobs.get(id)).map(this::copy);
    }

    @Override
    public ProcessingJob update(String id, UnaryOperator<ProcessingJob> mutation) {
        ProcessingJob updated = jobs.computeIfPresent(id, (key, current) -> copy(mutation.apply(copy(current))));
        if (updated == null) {
            throw new NoSuchElementException("Job not found: " + id);
        }
        return copy(updated);
    }

    @Override
    public List<ProcessingJob> findByStatus(JobStatus status) {
        return jobs.values().stream()
                .filter(job -> job.getStatus() == status)
                .map(this::copy)
                .collect(Collectors.toList());
    }

    private ProcessingJob copy(ProcessingJob job) {
        List<DetectedTree> trees = new ArrayList<>();
        if (job.getTrees() != null) {
            for (DetectedTree tree : job.getTrees()) {
                trees.add(tree.toBuilder()
                        .location(tree.getLocation() != null ? (Point) tree.getLocation().copy() : null)
                        .build());
            }
        }
        return job.toBuilder()
                .config(job.getConfig() != null ? job.getConfig().toBuilder().build() : null)
                .area(job.getArea() != null ? job.getArea().copy() : null)
                .trees(trees)
                .build();
    }
}
