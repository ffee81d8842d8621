package org.Aayush.allocator.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.allocator.cluster.ClusterResult;
import org.Aayush.allocator.cluster.ClusterStatistics;

import java.util.List;

@Value
@Builder
public class ClusterResponse {
    ClusterResult result;
    List<ClusterStatistics> statistics;
    InvocationMetadata metadata;
}
