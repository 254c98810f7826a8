package com.example.retrievalservice.dto.response;

import com.example.retrievalservice.dto.SubmissionResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response body of the submission endpoint: a single message keyed by its kind
 * ({@code Acknowledgement}, {@code Warning} or {@code Invalid Request}), plus the job id when accepted.
 */
public final class SubmissionResponse {

    static final String ACKNOWLEDGEMENT = "Acknowledgement";
    static final String WARNING = "Warning";
    static final String INVALID_REQUEST = "Invalid Request";

    private SubmissionResponse() {
    }

    public static Map<String, String> from(SubmissionResult result) {
        Map<String, String> body = new LinkedHashMap<>();
        switch (result.getOutcome()) {
            case ACCEPTED -> {
                body.put(ACKNOWLEDGEMENT, result.getMessage());
                body.put("jobId", result.getJobId().toString());
            }
            case DENY_LISTED -> body.put(WARNING, result.getMessage());
            case DUPLICATE -> body.put(INVALID_REQUEST, result.getMessage());
        }
        return body;
    }
}
