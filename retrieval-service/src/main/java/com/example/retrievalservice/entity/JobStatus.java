package com.example.retrievalservice.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Retrieval job status.
 *
 * Allowed transitions:
 * - SUBMITTED -> PROCESSING | CANCELLED | FAILED
 * - PROCESSING -> COMPLETED | FAILED
 * COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum JobStatus {
    SUBMITTED,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean canTransitionTo(JobStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    private Set<JobStatus> allowedTargets() {
        switch (this) {
            case SUBMITTED:
                // FAILED covers errors raised before the worker could mark the job as processing
                return EnumSet.of(PROCESSING, CANCELLED, FAILED);
            case PROCESSING:
                return EnumSet.of(COMPLETED, FAILED);
            default:
                return EnumSet.noneOf(JobStatus.class);
        }
    }

    /**
     * Lower-case form stored in the job table.
     */
    public String dbValue() {
        return name().toLowerCase();
    }
}
