package org.Aayush.allocator.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.allocator.cluster.ClusterBalance;
import org.Aayush.allocator.distance.DistanceMetric;

/**
 * Observability block attached to every engine response.
 */
@Value
@Builder
public class InvocationMetadata {
    /** Engine operation, for example {@code cluster} or {@code assign}. */
    String operation;
    /** Stage method or backend id. */
    String method;
    DistanceMetric metric;
    int pointCount;
    long elapsedMillis;
    /** Iterations of the clustering stage; null for other operations. */
    Integer iterations;
    /** Convergence of the clustering stage; null for other operations. */
    Boolean converged;
    ClusterBalance balance;
    String implementationNote;
}
