package com.lidar.pipeline;

import com.lidar.exception.JobTimeoutException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void testCapUsesTimeLeft() {
        Deadline deadline = new Deadline(Clock.fixed(START, ZoneOffset.UTC), Duration.ofMinutes(5));

        assertEquals(Duration.ofMinutes(5), deadline.cap(Duration.ofMinutes(30), PipelinePhase.TILING));
        assertEquals(Duration.ofMinutes(1), deadline.cap(Duration.ofMinutes(1), PipelinePhase.TILING));
        assertFalse(deadline.isExpired());
    }

    @Test
    void testExpiredDeadlineStopsNextPhase() {
        Deadline deadline = new Deadline(Clock.fixed(START, ZoneOffset.UTC), Duration.ZERO);

        assertTrue(deadline.isExpired());
        assertEquals(Duration.ZERO, deadline.remaining());
        JobTimeoutException error = assertThrows(JobTimeoutException.class,
            () -> deadline.check(PipelinePhase.PUBLISH));
        assertTrue(error.getMessage().contains("publish"));
    }
}
