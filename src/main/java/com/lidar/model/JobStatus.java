package com.lidar.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Processing job status. Transitions only move forward along
 * pending -> queued -> processing -> {completed | failed}; the last two are terminal.
 */
public enum JobStatus {
    PENDING,
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a job in this status may move to {@code next}. A running job cannot be
     * started again; progress updates while processing do not change the status.
     */
    public boolean canTransitionTo(JobStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return switch (next) {
            case PENDING -> this == PENDING;
            case QUEUED -> this == PENDING || this == QUEUED;
            case PROCESSING -> this == PENDING || this == QUEUED;
            // a job can be failed at any non-terminal point, e.g. cancelled while queued
            case FAILED -> true;
            case COMPLETED -> this == PROCESSING;
        };
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
