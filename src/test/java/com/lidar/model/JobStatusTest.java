package com.lidar.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JobStatusTest {

    @Test
    void testForwardTransitionsAllowed() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.QUEUED));
        assertTrue(JobStatus.QUEUED.canTransitionTo(JobStatus.PROCESSING));
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.PROCESSING));
        assertTrue(JobStatus.PROCESSING.canTransitionTo(JobStatus.COMPLETED));
        assertTrue(JobStatus.PROCESSING.canTransitionTo(JobStatus.FAILED));
        assertTrue(JobStatus.QUEUED.canTransitionTo(JobStatus.FAILED));
    }

    @Test
    void testBackwardTransitionsRejected() {
        assertFalse(JobStatus.QUEUED.canTransitionTo(JobStatus.PENDING));
        assertFalse(JobStatus.PROCESSING.canTransitionTo(JobStatus.QUEUED));
        assertFalse(JobStatus.QUEUED.canTransitionTo(JobStatus.COMPLETED));
        assertFalse(JobStatus.PROCESSING.canTransitionTo(JobStatus.PROCESSING));
    }

    @Test
    void testTerminalStatesAreFinal() {
        for (JobStatus next : JobStatus.values()) {
            assertFalse(JobStatus.COMPLETED.canTransitionTo(next), "completed -> " + next);
            assertFalse(JobStatus.FAILED.canTransitionTo(next), "failed -> " + next);
        }
        assertTrue(JobStatus.COMPLETED.isTerminal());
        assertFalse(JobStatus.PROCESSING.isTerminal());
    }

    @Test
    void testJsonValueIsLowercase() {
        assertEquals("processing", JobStatus.PROCESSING.toValue());
        assertEquals(JobStatus.FAILED, JobStatus.fromValue(" Failed "));
    }

    @Test
    void testColorModeDefaultsToHeight() {
        assertEquals(ColorMode.HEIGHT, ColorMode.fromValue(null));
        assertEquals(ColorMode.NDVI, ColorMode.fromValue("ndvi"));
    }
}
