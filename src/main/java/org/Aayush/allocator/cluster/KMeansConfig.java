package org.Aayush.allocator.cluster;

import lombok.Builder;
import lombok.Value;

/**
 * K-means tuning knobs.
 */
@Value
@Builder(toBuilder = true)
public class KMeansConfig {
    /** Iteration cap per run. */
    @Builder.Default
    int maxIterations = 300;

    /** Number of seeded restarts; the lowest-inertia run wins. */
    @Builder.Default
    int nInit = 10;

    public static KMeansConfig defaults() {
        return KMeansConfig.builder().build();
    }
}
