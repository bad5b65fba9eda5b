package com.hangar.core.retry;

/**
 * Thrown when every attempt of a {@link RetryPolicy} failed.
 * The cause is the failure of the last attempt.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastFailure) {
        super("Gave up after " + attempts + " attempt(s)"
                + (lastFailure != null ? ": " + lastFailure.getMessage() : ""), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
