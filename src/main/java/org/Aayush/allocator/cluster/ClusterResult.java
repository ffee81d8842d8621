package org.Aayush.allocator.cluster;

import lombok.Builder;
import lombok.Value;
import org.Aayush.allocator.error.SolverException;
import org.Aayush.allocator.model.Coordinate;
import org.Aayush.allocator.model.Located;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one clustering invocation.
 *
 * <p>{@code labels[i]} is the cluster id of point {@code i}; {@code clusters} lists every
 * id in {@code [0, k)} in order, including empty ones.</p>
 */
@Value
@Builder
public class ClusterResult {
    public static final String REASON_INVALID_LABELS = "CLUSTER_INVALID_LABELS";

    ClusteringMethod method;
    int[] labels;
    List<Cluster> clusters;
    int iterations;
    boolean converged;
    /** Sum of squared point-to-centroid distances; null for methods without centroids. */
    Double inertia;
    ClusterBalance balance;
    /** Backend note for observability. */
    String implementationNote;

    public int[] getLabels() {
        return labels.clone();
    }

    public int clusterCount() {
        return clusters.size();
    }

    /**
     * Assembles a validated result from raw labels.
     *
     * @param centroids per-cluster centroids, or null to derive coordinate means.
     * @throws SolverException when labels do not cover {@code [0, n)} with ids in {@code [0, k)}.
     */
    public static ClusterResult fromLabels(
            ClusteringMethod method,
            List<? extends Located> points,
            int[] labels,
            int k,
            Coordinate[] centroids,
            int iterations,
            boolean converged,
            Double inertia,
            String implementationNote
    ) {
        int n = points.size();
        if (labels == null || labels.length != n) {
            throw new SolverException(
                    REASON_INVALID_LABELS,
                    method.id(),
                    "expected " + n + " labels but got " + (labels == null ? "none" : labels.length)
            );
        }
        int[] sizes = new int[k];
        for (int i = 0; i < n; i++) {
            int label = labels[i];
            if (label < 0 || label >= k) {
                throw new SolverException(
                        REASON_INVALID_LABELS,
                        method.id(),
                        "label " + label + " of point " + i + " outside [0, " + k + ") for n=" + n
                );
            }
            sizes[label]++;
        }

        int[][] members = new int[k][];
        for (int c = 0; c < k; c++) {
            members[c] = new int[sizes[c]];
        }
        int[] fill = new int[k];
        for (int i = 0; i < n; i++) {
            members[labels[i]][fill[labels[i]]++] = i;
        }

        List<Cluster> clusters = new ArrayList<>(k);
        for (int c = 0; c < k; c++) {
            Coordinate centroid = centroids != null ? centroids[c] : meanOf(points, members[c]);
            clusters.add(Cluster.builder()
                    .id(c)
                    .memberIndices(members[c])
                    .centroid(centroid)
                    .build());
        }
        return ClusterResult.builder()
                .method(method)
                .labels(labels.clone())
                .clusters(List.copyOf(clusters))
                .iterations(iterations)
                .converged(converged)
                .inertia(inertia)
                .balance(ClusterBalance.of(sizes, n))
                .implementationNote(implementationNote)
                .build();
    }

    static Coordinate meanOf(List<? extends Located> points, int[] members) {
        if (members.length == 0) {
            return null;
        }
        double lon = 0.0d;
        double lat = 0.0d;
        for (int index : members) {
            lon += points.get(index).getLongitude();
            lat += points.get(index).getLatitude();
        }
        return new Coordinate(lon / members.length, lat / members.length);
    }
}
