package org.Aayush.allocator.external;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Builder;
import lombok.Value;
import org.Aayush.allocator.error.ExternalServiceException;

import java.time.Duration;

/**
 * Bounded exponential backoff for transient external-service failures.
 *
 * <p>Translated into a resilience4j {@link RetryConfig} that retries only
 * {@link ExternalServiceException}s flagged as transient.</p>
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {
    /** Total attempts per call including the first one. */
    @Builder.Default
    int maxAttempts = 4;

    /** Delay before the first retry. */
    @Builder.Default
    Duration initialBackoff = Duration.ofMillis(250L);

    /** Growth factor applied per failed attempt. */
    @Builder.Default
    double multiplier = 2.0d;

    /** Upper bound of any single delay. */
    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(5L);

    /**
     * Default policy instance.
     */
    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    /**
     * Policy that gives every call exactly one attempt.
     */
    public static RetryPolicy noRetry() {
        return RetryPolicy.builder().maxAttempts(1).build();
    }

    /**
     * Interval function shared by {@link #backoffFor(int)} and {@link #toRetryConfig()}.
     */
    public IntervalFunction intervalFunction() {
        if (initialBackoff.toMillis() < 1L) {
            throw new IllegalArgumentException("initialBackoff must be at least 1 ms");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        return IntervalFunction.ofExponentialBackoff(initialBackoff.toMillis(), multiplier, maxBackoff.toMillis());
    }

    /**
     * Builds the resilience4j configuration for one external service.
     */
    public RetryConfig toRetryConfig() {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction())
                .retryOnException(RetryPolicy::isTransient)
                .build();
    }

    /**
     * Returns the delay to wait after {@code failedAttempts} consecutive failures.
     *
     * @param failedAttempts number of failed attempts so far, at least 1.
     */
    public Duration backoffFor(int failedAttempts) {
        if (failedAttempts < 1) {
            throw new IllegalArgumentException("failedAttempts must be >= 1");
        }
        return Duration.ofMillis(intervalFunction().apply(failedAttempts));
    }

    static boolean isTransient(Throwable failure) {
        return failure instanceof ExternalServiceException external && external.transientFailure();
    }
}
