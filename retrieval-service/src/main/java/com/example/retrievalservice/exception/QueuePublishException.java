package com.example.retrievalservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Job row was written but the queue did not take the message (HTTP 503).
 */
public class QueuePublishException extends BaseException {

    public QueuePublishException(String jobId, Throwable cause) {
        super("QUEUE_UNAVAILABLE",
            String.format("Job %s was recorded but could not be queued", jobId),
            HttpStatus.SERVICE_UNAVAILABLE,
            cause);
    }
}
