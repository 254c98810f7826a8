package com.example.retrievalservice.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Exception for resource not found errors (HTTP 404).
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    public static ResourceNotFoundException jobNotFound(UUID jobId) {
        return new ResourceNotFoundException(
            "JOB_NOT_FOUND",
            String.format("Job with ID %s not found", jobId)
        );
    }
}
