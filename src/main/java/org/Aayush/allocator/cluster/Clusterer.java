package org.Aayush.allocator.cluster;

import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.model.Located;

import java.util.List;

/**
 * Partitions a point set into {@code k} groups.
 *
 * <p>Implementations must return clusters that cover {@code [0, n)} exactly once and must
 * be deterministic for a fixed seed.</p>
 */
public interface Clusterer {
    /**
     * Method implemented by this clusterer.
     */
    ClusteringMethod method();

    /**
     * @param points points in input order.
     * @param matrix square {@code n x n} matrix over {@code points}.
     * @param k requested cluster count, {@code 1 <= k <= n}.
     * @param seed explicit random seed.
     * @throws org.Aayush.allocator.error.ValidationException on invalid {@code k} or matrix shape.
     * @throws org.Aayush.allocator.error.SolverException when a backend produces no usable labels.
     */
    ClusterResult partition(List<? extends Located> points, DistanceMatrix matrix, int k, long seed);
}
