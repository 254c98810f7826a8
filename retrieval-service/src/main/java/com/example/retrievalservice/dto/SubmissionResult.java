package com.example.retrievalservice.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Result of a retrieval submission. Rejections are expected outcomes, not errors.
 */
@Getter
@AllArgsConstructor
public class SubmissionResult {

    public enum Outcome {
        ACCEPTED,
        DENY_LISTED,
        DUPLICATE
    }

    static final String ACCEPTED_MESSAGE = "Your download request has been submitted. You will receive an email "
            + "response to your request with a download link. Once your request has been processed, the download "
            + "link will remain valid for 24 hours";
    static final String DENY_LISTED_MESSAGE = "Your request cannot be fulfilled since your email address is in "
            + "deny list, please contact RDS admin if you think you are wrongly put on this list.";
    static final String DUPLICATE_MESSAGE = "You submitted duplicate requests in short timeframe, please wait for "
            + "completion of your prior request. Thank you for your cooperation.";

    private final Outcome outcome;
    private final String message;
    private final UUID jobId;

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }

    public static SubmissionResult accepted(UUID jobId) {
        return new SubmissionResult(Outcome.ACCEPTED, ACCEPTED_MESSAGE, jobId);
    }

    public static SubmissionResult denyListed() {
        return new SubmissionResult(Outcome.DENY_LISTED, DENY_LISTED_MESSAGE, null);
    }

    public static SubmissionResult duplicate() {
        return new SubmissionResult(Outcome.DUPLICATE, DUPLICATE_MESSAGE, null);
    }
}
