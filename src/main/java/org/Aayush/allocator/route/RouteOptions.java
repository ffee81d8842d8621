package org.Aayush.allocator.route;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-invocation route solving options.
 */
@Value
@Builder(toBuilder = true)
public class RouteOptions {
    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofSeconds(1L);

    @Builder.Default
    RouteBackend backend = RouteBackend.APPROXIMATION;

    /** Index of the fixed first point; null lets the solver choose. */
    Integer startIndex;

    /** Search budget for the exact backend; null means {@link #DEFAULT_TIME_LIMIT}. */
    Duration timeLimit;

    /** Return to the start point at the end of the route. */
    @Builder.Default
    boolean closed = true;

    @Builder.Default
    ApproximationMode approximationMode = ApproximationMode.CHRISTOFIDES;

    /** Largest input the external trip service accepts. */
    @Builder.Default
    int maxExternalLocations = 100;

    public static RouteOptions defaults() {
        return RouteOptions.builder().build();
    }

    /**
     * Effective time limit for search-based backends.
     */
    public Duration effectiveTimeLimit() {
        return timeLimit == null ? DEFAULT_TIME_LIMIT : timeLimit;
    }
}
