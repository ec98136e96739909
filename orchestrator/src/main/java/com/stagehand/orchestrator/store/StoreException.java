package com.stagehand.orchestrator.store;

import java.sql.SQLException;

/**
 * Thrown when an operation against a project or app database fails.
 *
 * {@link #isBusy()} tells lock contention (SQLITE_BUSY / SQLITE_LOCKED),
 * which is retried, apart from every other store failure, which is not.
 */
public class StoreException extends RuntimeException {

    private static final int SQLITE_BUSY   = 5;
    private static final int SQLITE_LOCKED = 6;

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isBusy() {
        return isBusyError(this);
    }

    /** True if any cause in the chain is a SQLite BUSY or LOCKED error. */
    public static boolean isBusyError(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SQLException) {
                int primary = ((SQLException) c).getErrorCode() & 0xff;
                if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) return true;
            }
            if (c.getCause() == c) break;
        }
        return false;
    }
}
