package org.Aayush.allocator.distance;

import org.Aayush.allocator.model.Located;

import java.util.List;

/**
 * One distance metric implementation behind the matrix provider.
 */
public interface DistanceMetricStrategy {
    /**
     * Metric this strategy implements.
     */
    DistanceMetric metric();

    /**
     * Validates one location for metric-specific coordinate constraints.
     *
     * @throws org.Aayush.allocator.error.ValidationException when the location is unusable.
     */
    void validate(Located location);

    /**
     * Validates configuration (credentials, limits) before any work starts.
     */
    default void validateConfig(DistanceConfig config) {
    }

    /**
     * Computes the square matrix over {@code points}; the diagonal must be zero.
     */
    DistanceMatrix computeSquare(List<? extends Located> points, DistanceConfig config);

    /**
     * Computes the rectangular {@code sources x targets} matrix.
     */
    DistanceMatrix computeRectangular(
            List<? extends Located> sources,
            List<? extends Located> targets,
            DistanceConfig config
    );
}
