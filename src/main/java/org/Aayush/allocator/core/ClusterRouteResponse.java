package org.Aayush.allocator.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.allocator.cluster.ClusterResult;

import java.util.List;

@Value
@Builder
public class ClusterRouteResponse {
    ClusterResult clusters;
    /** One route per non-empty cluster, in cluster id order. */
    List<ClusterRoute> routes;
    InvocationMetadata metadata;
}
