package com.stagehand.orchestrator.tracker;

/**
 * A tracker call failed.
 *
 * {@code status} is the HTTP status, 0 for transport failures and -1 for
 * GraphQL-level errors returned with HTTP 200.
 */
public class IssueTrackerException extends RuntimeException {

    public static final int TRANSPORT = 0;
    public static final int GRAPHQL   = -1;

    private final int status;

    public IssueTrackerException(String message, int status) {
        super(message);
        this.status = status;
    }

    public IssueTrackerException(String message, Throwable cause) {
        super(message, cause);
        this.status = TRANSPORT;
    }

    public int status() { return status; }

    /** Transport failures, 429 and 5xx are worth another try; auth and GraphQL errors are not. */
    public boolean isRetryable() {
        return status == TRANSPORT || status == 429 || status >= 500;
    }
}
