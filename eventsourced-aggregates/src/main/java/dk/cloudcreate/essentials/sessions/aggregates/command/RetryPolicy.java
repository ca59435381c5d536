package dk.cloudcreate.essentials.sessions.aggregates.command;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * How often, and with which delay, a command is re-applied after a {@code ConcurrencyException}
 */
public final class RetryPolicy {
    public enum Backoff {
        FIXED,
        LINEAR,
        EXPONENTIAL
    }

    public final Backoff  backoff;
    /**
     * Total number of attempts, including the first one
     */
    public final int      maxAttempts;
    public final Duration retryDelay;
    public final double   retryDelayMultiplier;
    public final Duration maximumRetryDelay;

    public RetryPolicy(Backoff backoff,
                       int maxAttempts,
                       Duration retryDelay,
                       double retryDelayMultiplier,
                       Duration maximumRetryDelay) {
        this.backoff = requireNonNull(backoff, "You must specify a backoff");
        this.retryDelay = requireNonNull(retryDelay, "You must specify a retryDelay");
        this.maximumRetryDelay = requireNonNull(maximumRetryDelay, "You must specify a maximumRetryDelay");
        checkArgument(maxAttempts >= 1, "maxAttempts must be 1 or larger");
        checkArgument(retryDelayMultiplier >= 1.0d, "retryDelayMultiplier must be 1.0 or larger");
        this.maxAttempts = maxAttempts;
        this.retryDelayMultiplier = retryDelayMultiplier;
    }

    /**
     * @param numberOfFailedAttempts the number of attempts that have failed so far (1 or larger)
     * @return the delay before the next attempt
     */
    public Duration calculateRetryDelay(int numberOfFailedAttempts) {
        checkArgument(numberOfFailedAttempts >= 1, "numberOfFailedAttempts must be 1 or larger");
        Duration calculatedRetryDelay;
        switch (backoff) {
            case LINEAR:
                calculatedRetryDelay = retryDelay.multipliedBy(numberOfFailedAttempts);
                break;
            case EXPONENTIAL:
                calculatedRetryDelay = Duration.ofMillis((long) (retryDelay.toMillis() * Math.pow(retryDelayMultiplier, numberOfFailedAttempts - 1)));
                break;
            default:
                calculatedRetryDelay = retryDelay;
        }
        if (calculatedRetryDelay.compareTo(maximumRetryDelay) >= 0) {
            return maximumRetryDelay;
        }
        return calculatedRetryDelay;
    }

    public boolean shouldRetry(int numberOfFailedAttempts) {
        return numberOfFailedAttempts < maxAttempts;
    }

    public static RetryPolicy fixedBackoff(Duration retryDelay, int maxAttempts) {
        return new RetryPolicy(Backoff.FIXED, maxAttempts, retryDelay, 1.0d, retryDelay);
    }

    public static RetryPolicy linearBackoff(Duration retryDelay, Duration maximumRetryDelay, int maxAttempts) {
        return new RetryPolicy(Backoff.LINEAR, maxAttempts, retryDelay, 1.0d, maximumRetryDelay);
    }

    public static RetryPolicy exponentialBackoff(Duration initialRetryDelay,
                                                 double retryDelayMultiplier,
                                                 Duration maximumRetryDelay,
                                                 int maxAttempts) {
        return new RetryPolicy(Backoff.EXPONENTIAL, maxAttempts, initialRetryDelay, retryDelayMultiplier, maximumRetryDelay);
    }

    /**
     * A conflict is reported to the caller right away
     */
    public static RetryPolicy noRetries() {
        return fixedBackoff(Duration.ZERO, 1);
    }

    /**
     * 3 attempts with an exponential backoff starting at 10 ms
     */
    public static RetryPolicy defaultPolicy() {
        return exponentialBackoff(Duration.ofMillis(10), 2.0d, Duration.ofMillis(500), 3);
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "backoff=" + backoff +
                ", maxAttempts=" + maxAttempts +
                ", retryDelay=" + retryDelay +
                ", retryDelayMultiplier=" + retryDelayMultiplier +
                ", maximumRetryDelay=" + maximumRetryDelay +
                '}';
    }
}
