package com.tierstore.runtime;

/**
 * Checked wrapper around the last failure of a {@link RetryPolicy} run; callers translate it into
 * their own typed error.
 */
public class RetryExhaustedException extends Exception {
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Exception last) {
        super(operation + " failed after " + attempts + " attempt(s): " + last.getMessage(), last);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }

    public Exception last() {
        return (Exception) getCause();
    }
}
