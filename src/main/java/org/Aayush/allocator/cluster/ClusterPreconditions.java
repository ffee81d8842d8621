package org.Aayush.allocator.cluster;

import lombok.experimental.UtilityClass;
import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.model.Located;

import java.util.List;
import java.util.Objects;

/**
 * Shared input checks for clusterers.
 */
@UtilityClass
public class ClusterPreconditions {
    public static final String REASON_INVALID_K = "CLUSTER_INVALID_K";
    static final String REASON_MATRIX_SHAPE = "CLUSTER_MATRIX_SHAPE";

    static void validate(List<? extends Located> points, DistanceMatrix matrix, int k) {
        Objects.requireNonNull(points, "points");
        Objects.requireNonNull(matrix, "matrix");
        int n = points.size();
        validateClusterCount(n, k);
        if (!matrix.square() || matrix.rows() != n) {
            throw new ValidationException(
                    REASON_MATRIX_SHAPE,
                    "matrix must be " + n + "x" + n + " but was " + matrix.rows() + "x" + matrix.cols()
            );
        }
    }

    /**
     * Rejects {@code k} outside {@code [1, n]}; needs no distance matrix.
     */
    public static void validateClusterCount(int n, int k) {
        if (k <= 0 || k > n) {
            throw new ValidationException(
                    REASON_INVALID_K,
                    Integer.toString(k),
                    "cluster count must be in [1, " + n + "] for " + n + " points"
            );
        }
    }
}
