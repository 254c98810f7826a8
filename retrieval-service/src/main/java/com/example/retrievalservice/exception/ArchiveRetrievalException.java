package com.example.retrievalservice.exception;

/**
 * Retrieval tool exited non-zero, timed out, or could not be started.
 */
public class ArchiveRetrievalException extends RuntimeException {

    private final boolean timedOut;

    public ArchiveRetrievalException(String message, boolean timedOut) {
        super(message);
        this.timedOut = timedOut;
    }

    public ArchiveRetrievalException(String message, Throwable cause) {
        super(message, cause);
        this.timedOut = false;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public static ArchiveRetrievalException timeout(long timeoutSeconds) {
        return new ArchiveRetrievalException(
            String.format("Archive retrieval exceeded timeout of %d seconds", timeoutSeconds), true);
    }

    public static ArchiveRetrievalException exitCode(int exitCode, String command) {
        return new ArchiveRetrievalException(
            String.format("Archive retrieval exited with code %d: %s", exitCode, command), false);
    }
}
