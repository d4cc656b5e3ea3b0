package com.lidar.pipeline;

import com.lidar.exception.JobTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock budget of one job
 */
public class Deadline {

    private final Clock clock;
    private final Instant expiresAt;

    public Deadline(Clock clock, Duration budget) {
        this.clock = clock;
        this.expiresAt = clock.instant().plus(budget);
    }

    public static Deadline after(Duration budget) {
        return new Deadline(Clock.systemUTC(), budget);
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * @throws JobTimeoutException if the budget is used up
     */
    public void check(PipelinePhase phase) {
        if (isExpired()) {
            throw new JobTimeoutException("Job deadline passed before " + phase.name().toLowerCase());
        }
    }

    /**
     * The smaller of the given limit and the time left
     *
     * @throws JobTimeoutException if no time is left
     */
    public Duration cap(Duration limit, PipelinePhase phase) {
        check(phase);
        Duration left = remaining();
        return left.compareTo(limit) < 0 ? left : limit;
    }
}
