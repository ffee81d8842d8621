package org.Aayush.allocator.distance;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.model.Located;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for pairwise distance computation under a selectable metric.
 *
 * <p>Every location is validated before any strategy work starts, so a bad coordinate
 * or missing credential never costs a remote call. Empty inputs short-circuit to empty
 * matrices.</p>
 */
@Slf4j
public final class DistanceMatrixProvider {
    private final DistanceStrategyRegistry registry;

    public DistanceMatrixProvider() {
        this(DistanceStrategyRegistry.defaultRegistry());
    }

    public DistanceMatrixProvider(DistanceStrategyRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Computes the square {@code n x n} matrix over {@code points}.
     *
     * @throws org.Aayush.allocator.error.ValidationException on bad coordinates or config.
     * @throws org.Aayush.allocator.error.ExternalServiceException on remote failure.
     */
    public DistanceMatrix compute(List<? extends Located> points, DistanceMetric metric, DistanceConfig config) {
        Objects.requireNonNull(points, "points");
        DistanceMetricStrategy strategy = prepare(metric, config, points, List.of());
        if (points.isEmpty()) {
            return DistanceMatrix.empty(metric, 0, 0);
        }
        long startNanos = System.nanoTime();
        DistanceMatrix matrix = strategy.computeSquare(points, config);
        log.info(
                "computed {}x{} {} matrix in {} ms",
                matrix.rows(),
                matrix.cols(),
                metric.id(),
                (System.nanoTime() - startNanos) / 1_000_000L
        );
        return matrix;
    }

    /**
     * Computes the rectangular {@code sources x targets} matrix.
     */
    public DistanceMatrix compute(
            List<? extends Located> sources,
            List<? extends Located> targets,
            DistanceMetric metric,
            DistanceConfig config
    ) {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(targets, "targets");
        DistanceMetricStrategy strategy = prepare(metric, config, sources, targets);
        if (sources.isEmpty() || targets.isEmpty()) {
            return DistanceMatrix.empty(metric, sources.size(), targets.size());
        }
        long startNanos = System.nanoTime();
        DistanceMatrix matrix = strategy.computeRectangular(sources, targets, config);
        log.info(
                "computed {}x{} {} matrix in {} ms",
                matrix.rows(),
                matrix.cols(),
                metric.id(),
                (System.nanoTime() - startNanos) / 1_000_000L
        );
        return matrix;
    }

    private DistanceMetricStrategy prepare(
            DistanceMetric metric,
            DistanceConfig config,
            List<? extends Located> first,
            List<? extends Located> second
    ) {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(config, "config");
        DistanceMetricStrategy strategy = registry.strategy(metric);
        for (Located location : first) {
            strategy.validate(Objects.requireNonNull(location, "location"));
        }
        for (Located location : second) {
            strategy.validate(Objects.requireNonNull(location, "location"));
        }
        strategy.validateConfig(config);
        return strategy;
    }
}
