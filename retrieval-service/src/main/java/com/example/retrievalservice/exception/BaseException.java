package com.example.retrievalservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Business failure with a stable error code and the HTTP status it maps to.
 * GlobalExceptionHandler turns it into an ErrorResponse; 5xx codes are logged with the stack trace.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    protected BaseException(String code, String message, HttpStatus status) {
        this(code, message, status, null);
    }

    protected BaseException(String code, String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }

    /**
     * True when the failure is on our side (queue or store unavailable) rather than the caller's.
     */
    public boolean isServerError() {
        return status.is5xxServerError();
    }
}
