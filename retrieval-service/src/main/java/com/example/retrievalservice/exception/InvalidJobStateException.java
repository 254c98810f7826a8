package com.example.retrievalservice.exception;

import com.example.retrievalservice.entity.JobStatus;
import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Attempted job status change that the job lifecycle does not allow.
 */
public class InvalidJobStateException extends BaseException {

    public InvalidJobStateException(String message) {
        super("INVALID_JOB_STATE", message, HttpStatus.CONFLICT);
    }

    public static InvalidJobStateException illegalTransition(UUID jobId, JobStatus from, JobStatus to) {
        return new InvalidJobStateException(
            String.format("Job %s cannot move from %s to %s", jobId,
                from == null ? "none" : from.dbValue(), to.dbValue())
        );
    }
}
