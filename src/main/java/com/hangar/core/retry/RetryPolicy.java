package com.hangar.core.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Attempt-bounded retry with a fixed or growing delay between attempts.
 *
 * <p>Used where there is no push-based readiness signal, e.g. waiting for a
 * freshly started database to accept admin commands. The policy knows nothing
 * about what it retries.
 *
 * @param maxAttempts  total attempts including the first, at least 1
 * @param initialDelay pause after the first failure
 * @param multiplier   growth factor for each further pause; 1.0 for a fixed delay
 * @param maxDelay     upper bound for a single pause
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, was " + multiplier);
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            maxDelay = initialDelay;
        }
    }

    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay, 1.0, delay);
    }

    public static RetryPolicy backoff(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, multiplier, maxDelay);
    }

    /**
     * Pause before the given attempt (1-based). Attempt 1 never waits.
     */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 2);
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * Runs {@code action} until it returns without throwing or attempts run out.
     *
     * @param description label for log lines
     * @param action      the work to retry
     * @param sleeper     pause implementation
     * @return the first successful result
     * @throws RetryExhaustedException when every attempt failed or the wait was interrupted
     */
    public <T> T execute(String description, Callable<T> action, Sleeper sleeper) {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Duration pause = delayBefore(attempt);
            if (!pause.isZero()) {
                try {
                    sleeper.sleep(pause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException(attempt - 1, e);
                }
            }
            try {
                T result = action.call();
                if (attempt > 1) {
                    log.debug("{} succeeded on attempt {}/{}", description, attempt, maxAttempts);
                }
                return result;
            } catch (Exception e) {
                lastFailure = e;
                log.debug("{} attempt {}/{} failed: {}", description, attempt, maxAttempts, e.getMessage());
            }
        }
        throw new RetryExhaustedException(maxAttempts, lastFailure);
    }
}
