package org.Aayush.allocator.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.allocator.route.Route;

/**
 * Route solved inside one cluster.
 */
@Value
@Builder
public class ClusterRoute {
    int clusterId;
    /** Route over cluster-local indices. */
    Route route;
    /** Input point indices in visiting order. */
    int[] pointIndices;

    public int[] getPointIndices() {
        return pointIndices.clone();
    }
}
