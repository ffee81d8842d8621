package org.Aayush.allocator.distance;

import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.model.Coordinate;
import org.Aayush.allocator.model.Located;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable metric-strategy registry.
 */
public final class DistanceStrategyRegistry {
    public static final String REASON_NON_FINITE_COORDINATES = "DIST_NON_FINITE_COORDINATES";
    public static final String REASON_LAT_LON_RANGE = "DIST_LAT_LON_RANGE";

    private static final double MIN_LAT = -90.0d;
    private static final double MAX_LAT = 90.0d;
    private static final double MIN_LON = -180.0d;
    private static final double MAX_LON = 180.0d;

    private final Map<DistanceMetric, DistanceMetricStrategy> strategyByMetric;

    /**
     * Creates a registry with all built-in strategies.
     */
    public DistanceStrategyRegistry() {
        this(List.of());
    }

    /**
     * Creates a registry by merging built-ins with custom strategies.
     *
     * <p>Custom strategies replace built-ins registered for the same metric.</p>
     */
    public DistanceStrategyRegistry(Collection<? extends DistanceMetricStrategy> customStrategies) {
        EnumMap<DistanceMetric, DistanceMetricStrategy> merged = new EnumMap<>(DistanceMetric.class);
        for (DistanceMetricStrategy strategy : defaultStrategies()) {
            merged.put(strategy.metric(), strategy);
        }
        if (customStrategies != null) {
            for (DistanceMetricStrategy strategy : customStrategies) {
                DistanceMetricStrategy nonNull = Objects.requireNonNull(strategy, "strategy");
                merged.put(Objects.requireNonNull(nonNull.metric(), "metric"), nonNull);
            }
        }
        this.strategyByMetric = Map.copyOf(merged);
    }

    /**
     * Resolves the strategy for a metric.
     */
    public DistanceMetricStrategy strategy(DistanceMetric metric) {
        DistanceMetricStrategy strategy = strategyByMetric.get(Objects.requireNonNull(metric, "metric"));
        if (strategy == null) {
            throw new ValidationException(DistanceMetric.REASON_UNKNOWN_METRIC, metric.id(), "no strategy registered");
        }
        return strategy;
    }

    /**
     * Returns immutable set of registered metrics.
     */
    public Set<DistanceMetric> metrics() {
        return strategyByMetric.keySet();
    }

    public static DistanceStrategyRegistry defaultRegistry() {
        return new DistanceStrategyRegistry();
    }

    private static List<DistanceMetricStrategy> defaultStrategies() {
        return List.of(
                new PlanarStrategy(),
                new GreatCircleStrategy(),
                ExternalTableStrategy.routing(),
                ExternalTableStrategy.mapping()
        );
    }

    static void requireFinite(Located location) {
        if (!Double.isFinite(location.getLongitude()) || !Double.isFinite(location.getLatitude())) {
            throw new ValidationException(
                    REASON_NON_FINITE_COORDINATES,
                    location.getId(),
                    "coordinates must be finite"
            );
        }
    }

    static void requireLatLonRange(Located location) {
        requireFinite(location);
        double lon = location.getLongitude();
        double lat = location.getLatitude();
        if (lat < MIN_LAT || lat > MAX_LAT || lon < MIN_LON || lon > MAX_LON) {
            throw new ValidationException(
                    REASON_LAT_LON_RANGE,
                    location.getId(),
                    "longitude/latitude must be in [-180,180] and [-90,90] but was (" + lon + ", " + lat + ")"
            );
        }
    }

    /**
     * Shared dense computation for coordinate-only metrics.
     */
    private abstract static class PureFunctionStrategy implements DistanceMetricStrategy {

        abstract double between(Located from, Located to);

        @Override
        public DistanceMatrix computeSquare(List<? extends Located> points, DistanceConfig config) {
            int n = points.size();
            double[] cells = new double[n * n];
            // Upper triangle mirrored so symmetry holds bit-for-bit.
            for (int i = 0; i < n; i++) {
                Located from = points.get(i);
                for (int j = i + 1; j < n; j++) {
                    double value = between(from, points.get(j));
                    cells[i * n + j] = value;
                    cells[j * n + i] = value;
                }
            }
            return DistanceMatrix.of(metric(), n, n, cells, null);
        }

        @Override
        public DistanceMatrix computeRectangular(
                List<? extends Located> sources,
                List<? extends Located> targets,
                DistanceConfig config
        ) {
            int rows = sources.size();
            int cols = targets.size();
            double[] cells = new double[rows * cols];
            for (int i = 0; i < rows; i++) {
                Located from = sources.get(i);
                for (int j = 0; j < cols; j++) {
                    cells[i * cols + j] = between(from, targets.get(j));
                }
            }
            return DistanceMatrix.of(metric(), rows, cols, cells, null);
        }
    }

    private static final class PlanarStrategy extends PureFunctionStrategy {
        @Override
        public DistanceMetric metric() {
            return DistanceMetric.PLANAR;
        }

        @Override
        public void validate(Located location) {
            requireFinite(location);
        }

        @Override
        double between(Located from, Located to) {
            return CoordinateDistance.planar(Coordinate.of(from), Coordinate.of(to));
        }
    }

    private static final class GreatCircleStrategy extends PureFunctionStrategy {
        @Override
        public DistanceMetric metric() {
            return DistanceMetric.GREAT_CIRCLE;
        }

        @Override
        public void validate(Located location) {
            requireLatLonRange(location);
        }

        @Override
        double between(Located from, Located to) {
            return CoordinateDistance.haversineMeters(Coordinate.of(from), Coordinate.of(to));
        }
    }
}
