package com.stagehand.orchestrator.vcs;

/**
 * A git or gh command exited non-zero or could not be run.
 * {@code exitCode} is -1 when the process never started.
 */
public class VersionControlException extends RuntimeException {

    private final int exitCode;

    public VersionControlException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public VersionControlException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public int exitCode() { return exitCode; }
}
