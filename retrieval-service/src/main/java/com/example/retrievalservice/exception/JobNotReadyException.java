package com.example.retrievalservice.exception;

import com.example.retrievalservice.entity.JobStatus;
import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Token requested for a job that has not completed (HTTP 409).
 */
public class JobNotReadyException extends BaseException {

    public JobNotReadyException(UUID jobId, JobStatus status) {
        super("JOB_NOT_READY",
            String.format("Job %s is %s, tokens are only issued for completed jobs", jobId, status.dbValue()),
            HttpStatus.CONFLICT);
    }
}
