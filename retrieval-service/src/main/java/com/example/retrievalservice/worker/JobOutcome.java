package com.example.retrievalservice.worker;

/**
 * How the worker finished with a queue message.
 */
public enum JobOutcome {
    COMPLETED,
    FAILED,
    /** Rejected by admission control; the message is dropped without redelivery. */
    CANCELLED,
    /** Message could not be tied to a job and was acknowledged without processing. */
    DISCARDED
}
