package org.Aayush.allocator.cluster;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.error.AllocatorException;
import org.Aayush.allocator.error.SolverException;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.model.Located;

import java.util.List;
import java.util.Objects;

/**
 * Clusters by balanced partitioning of a k-nearest-neighbor proximity graph.
 *
 * <p>Partitioner failures propagate as {@link SolverException}; there is no fallback to
 * another method.</p>
 */
@Slf4j
public final class GraphPartitionClusterer implements Clusterer {
    static final String REASON_INVALID_CONFIG = "CLUSTER_INVALID_CONFIG";

    private final GraphPartitionConfig config;
    private final GraphPartitioner partitioner;

    public GraphPartitionClusterer() {
        this(GraphPartitionConfig.defaults(), new KaffpaProcessPartitioner());
    }

    public GraphPartitionClusterer(GraphPartitionConfig config, GraphPartitioner partitioner) {
        this.config = Objects.requireNonNull(config, "config");
        this.partitioner = Objects.requireNonNull(partitioner, "partitioner");
        if (config.getNClosest() <= 0) {
            throw new ValidationException(REASON_INVALID_CONFIG, "nClosest", "nClosest must be positive");
        }
        if (!(config.getImbalance() >= 0.0d) || config.getImbalance() >= 1.0d) {
            throw new ValidationException(REASON_INVALID_CONFIG, "imbalance", "imbalance must be in [0, 1)");
        }
    }

    @Override
    public ClusteringMethod method() {
        return ClusteringMethod.GRAPH_PARTITION;
    }

    @Override
    public ClusterResult partition(List<? extends Located> points, DistanceMatrix matrix, int k, long seed) {
        ClusterPreconditions.validate(points, matrix, k);
        int n = points.size();
        if (k == 1) {
            return ClusterResult.fromLabels(
                    ClusteringMethod.GRAPH_PARTITION, points, new int[n], 1, null, 0, true, null, "single block"
            );
        }

        ProximityGraph graph = ProximityGraph.build(matrix, config.getNClosest());
        int[] labels;
        try {
            labels = partitioner.partition(graph, k, seed, config);
        } catch (AllocatorException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new SolverException(
                    KaffpaProcessPartitioner.REASON_PARTITION_FAILED,
                    partitioner.name(),
                    "partitioner failed for n=" + n + ", k=" + k + ": " + ex.getMessage(),
                    ex
            );
        }
        ClusterResult result = ClusterResult.fromLabels(
                ClusteringMethod.GRAPH_PARTITION,
                points,
                labels,
                k,
                null,
                1,
                true,
                null,
                partitioner.name() + " nClosest=" + config.getNClosest() + " imbalance=" + config.getImbalance()
        );
        log.info(
                "{} partitioned n={} into k={}; imbalance ratio {}",
                partitioner.name(),
                n,
                k,
                result.getBalance().getImbalanceRatio()
        );
        return result;
    }
}
