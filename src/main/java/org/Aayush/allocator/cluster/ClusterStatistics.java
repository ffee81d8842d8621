package org.Aayush.allocator.cluster;

import lombok.Builder;
import lombok.Value;
import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.route.MinimumSpanningTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-cluster compactness figures used to compare clustering methods.
 */
@Value
@Builder
public class ClusterStatistics {
    int clusterId;
    int size;
    /** Sum of {@code M[i][j]} over unordered member pairs. */
    double totalEdgeWeight;
    /** Weight of the minimum spanning tree over the members. */
    double spanningTreeWeight;

    /**
     * Computes statistics for every cluster of {@code result} against its source matrix.
     */
    public static List<ClusterStatistics> of(ClusterResult result, DistanceMatrix matrix) {
        List<ClusterStatistics> statistics = new ArrayList<>(result.clusterCount());
        for (Cluster cluster : result.getClusters()) {
            int[] members = cluster.getMemberIndices();
            double edgeWeight = 0.0d;
            for (int a = 0; a < members.length; a++) {
                for (int b = a + 1; b < members.length; b++) {
                    edgeWeight += matrix.distance(members[a], members[b]);
                }
            }
            statistics.add(ClusterStatistics.builder()
                    .clusterId(cluster.getId())
                    .size(members.length)
                    .totalEdgeWeight(edgeWeight)
                    .spanningTreeWeight(MinimumSpanningTree.weight(matrix.subMatrix(members)))
                    .build());
        }
        return List.copyOf(statistics);
    }
}
