package org.Aayush.allocator.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.allocator.cluster.ClusteringMethod;
import org.Aayush.allocator.cluster.GraphPartitionConfig;
import org.Aayush.allocator.cluster.KMeansConfig;
import org.Aayush.allocator.distance.DistanceConfig;
import org.Aayush.allocator.distance.DistanceMetric;
import org.Aayush.allocator.model.Point;

import java.util.List;

/**
 * Clustering request in caller id space.
 */
@Value
@Builder(toBuilder = true)
public class ClusterRequest {
    @Singular
    List<Point> points;
    int k;
    long seed;
    @Builder.Default
    DistanceMetric metric = DistanceMetric.PLANAR;
    @Builder.Default
    ClusteringMethod method = ClusteringMethod.KMEANS;
    @Builder.Default
    DistanceConfig distanceConfig = DistanceConfig.defaults();
    @Builder.Default
    KMeansConfig kMeansConfig = KMeansConfig.defaults();
    @Builder.Default
    GraphPartitionConfig graphPartitionConfig = GraphPartitionConfig.defaults();
}
