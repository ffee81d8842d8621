package org.Aayush.allocator.distance;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.error.ExternalServiceException;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.external.ExternalCallExecutor;
import org.Aayush.allocator.external.GoogleDistanceMatrixClient;
import org.Aayush.allocator.external.HttpJsonTransport;
import org.Aayush.allocator.external.OsrmClient;
import org.Aayush.allocator.external.TableBlock;
import org.Aayush.allocator.external.TableServiceClient;
import org.Aayush.allocator.model.Located;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Distance strategy backed by a remote many-to-many table service.
 *
 * <p>Inputs are cut into blocks that respect the client's per-request limits and the
 * configured {@code maxTableSize}. Blocks are fetched through a bounded
 * {@link ExternalCallExecutor} and stitched back in input order. A cell the service could
 * not resolve fails the whole call.</p>
 */
@Slf4j
public final class ExternalTableStrategy implements DistanceMetricStrategy {
    public static final String REASON_MISSING_CREDENTIALS = "DIST_MISSING_CREDENTIALS";
    public static final String REASON_UNRESOLVED_CELL = "DIST_UNRESOLVED_CELL";
    public static final String REASON_INVALID_CONFIG = "DIST_INVALID_CONFIG";

    /**
     * Builds the table client for one invocation.
     */
    @FunctionalInterface
    public interface ClientFactory {
        TableServiceClient create(DistanceConfig config);
    }

    private final DistanceMetric metric;
    private final ClientFactory clientFactory;
    private final Consumer<DistanceConfig> configValidator;

    public ExternalTableStrategy(
            DistanceMetric metric,
            ClientFactory clientFactory,
            Consumer<DistanceConfig> configValidator
    ) {
        this.metric = Objects.requireNonNull(metric, "metric");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.configValidator = Objects.requireNonNull(configValidator, "configValidator");
        if (!metric.external()) {
            throw new IllegalArgumentException("metric " + metric.id() + " is not an external metric");
        }
    }

    /**
     * OSRM table service strategy.
     */
    public static ExternalTableStrategy routing() {
        return new ExternalTableStrategy(
                DistanceMetric.EXTERNAL_ROUTING,
                config -> new OsrmClient(
                        new HttpJsonTransport(config.getRequestTimeout()),
                        config.getRoutingBaseUrl(),
                        config.getRoutingProfile(),
                        config.getMaxTableSize()
                ),
                config -> requireNonBlank(config.getRoutingBaseUrl(), "routingBaseUrl")
        );
    }

    /**
     * Google Distance Matrix strategy; requires an API key.
     */
    public static ExternalTableStrategy mapping() {
        return new ExternalTableStrategy(
                DistanceMetric.EXTERNAL_MAPPING,
                config -> new GoogleDistanceMatrixClient(
                        new HttpJsonTransport(config.getRequestTimeout()),
                        config.getMappingBaseUrl(),
                        config.getMappingApiKey()
                ),
                config -> {
                    String key = config.getMappingApiKey();
                    if (key == null || key.isBlank()) {
                        throw new ValidationException(
                                REASON_MISSING_CREDENTIALS,
                                DistanceMetric.EXTERNAL_MAPPING.id(),
                                "mapping API key is required; set ALLOCATOR_MAPPING_API_KEY"
                        );
                    }
                    requireNonBlank(config.getMappingBaseUrl(), "mappingBaseUrl");
                }
        );
    }

    @Override
    public DistanceMetric metric() {
        return metric;
    }

    @Override
    public void validate(Located location) {
        DistanceStrategyRegistry.requireLatLonRange(location);
    }

    @Override
    public void validateConfig(DistanceConfig config) {
        if (config.getMaxTableSize() <= 0) {
            throw new ValidationException(REASON_INVALID_CONFIG, "maxTableSize", "maxTableSize must be positive");
        }
        if (config.getMaxConcurrentRequests() <= 0) {
            throw new ValidationException(
                    REASON_INVALID_CONFIG,
                    "maxConcurrentRequests",
                    "maxConcurrentRequests must be positive"
            );
        }
        if (config.getRetryPolicy().getMaxAttempts() <= 0) {
            throw new ValidationException(REASON_INVALID_CONFIG, "retryPolicy", "maxAttempts must be positive");
        }
        configValidator.accept(config);
    }

    @Override
    public DistanceMatrix computeSquare(List<? extends Located> points, DistanceConfig config) {
        double[][] assembled = fetchAll(points, points, config);
        int n = points.size();
        double[] distances = assembled[0];
        double[] durations = assembled[1];
        // Services may report a few meters between a point and itself after snapping.
        for (int i = 0; i < n; i++) {
            distances[i * n + i] = 0.0d;
            if (durations != null) {
                durations[i * n + i] = 0.0d;
            }
        }
        return DistanceMatrix.of(metric, n, n, distances, durations);
    }

    @Override
    public DistanceMatrix computeRectangular(
            List<? extends Located> sources,
            List<? extends Located> targets,
            DistanceConfig config
    ) {
        double[][] assembled = fetchAll(sources, targets, config);
        return DistanceMatrix.of(metric, sources.size(), targets.size(), assembled[0], assembled[1]);
    }

    private double[][] fetchAll(List<? extends Located> sources, List<? extends Located> targets, DistanceConfig config) {
        TableServiceClient client = clientFactory.create(config);
        int rows = sources.size();
        int cols = targets.size();
        BlockShape shape = BlockShape.of(client, config.getMaxTableSize());
        boolean includeDurations = config.isIncludeDurations();

        List<int[]> origins = new ArrayList<>();
        List<Supplier<TableBlock>> calls = new ArrayList<>();
        for (int rowStart = 0; rowStart < rows; rowStart += shape.rows()) {
            int rowEnd = Math.min(rows, rowStart + shape.rows());
            for (int colStart = 0; colStart < cols; colStart += shape.cols()) {
                int colEnd = Math.min(cols, colStart + shape.cols());
                List<? extends Located> sourceChunk = sources.subList(rowStart, rowEnd);
                List<? extends Located> targetChunk = targets.subList(colStart, colEnd);
                origins.add(new int[]{rowStart, colStart});
                calls.add(() -> client.fetch(sourceChunk, targetChunk, includeDurations));
            }
        }
        log.debug(
                "{}: {}x{} table split into {} blocks of at most {}x{}",
                client.serviceName(),
                rows,
                cols,
                calls.size(),
                shape.rows(),
                shape.cols()
        );

        int concurrency = Math.min(config.getMaxConcurrentRequests(), Math.max(1, client.maxConcurrentRequests()));
        List<TableBlock> blocks;
        try (ExternalCallExecutor executor = new ExternalCallExecutor(
                client.serviceName(),
                concurrency,
                config.getRetryPolicy()
        )) {
            blocks = executor.invokeAll(calls);
        }

        double[] distances = new double[rows * cols];
        double[] durations = includeDurations ? new double[rows * cols] : null;
        for (int b = 0; b < blocks.size(); b++) {
            TableBlock block = blocks.get(b);
            int rowStart = origins.get(b)[0];
            int colStart = origins.get(b)[1];
            int expectedRows = Math.min(shape.rows(), rows - rowStart);
            int expectedCols = Math.min(shape.cols(), cols - colStart);
            if (block == null || block.rows() != expectedRows || block.cols() != expectedCols) {
                throw new ExternalServiceException(
                        HttpJsonTransport.REASON_MALFORMED_RESPONSE,
                        client.serviceName(),
                        "block at (" + rowStart + "," + colStart + ") has wrong shape",
                        false
                );
            }
            if (includeDurations && block.durations() == null) {
                throw new ExternalServiceException(
                        HttpJsonTransport.REASON_MALFORMED_RESPONSE,
                        client.serviceName(),
                        "block at (" + rowStart + "," + colStart + ") is missing durations",
                        false
                );
            }
            for (int i = 0; i < expectedRows; i++) {
                for (int j = 0; j < expectedCols; j++) {
                    int global = (rowStart + i) * cols + (colStart + j);
                    int local = i * expectedCols + j;
                    distances[global] = block.distances()[local];
                    if (durations != null) {
                        durations[global] = block.durations()[local];
                    }
                }
            }
        }

        boolean square = sources == targets;
        requireResolved(distances, sources, targets, square, client.serviceName());
        if (durations != null) {
            requireResolved(durations, sources, targets, square, client.serviceName());
        }
        return new double[][]{distances, durations};
    }

    private static void requireResolved(
            double[] cells,
            List<? extends Located> sources,
            List<? extends Located> targets,
            boolean square,
            String service
    ) {
        int cols = targets.size();
        for (int cell = 0; cell < cells.length; cell++) {
            if (Double.isNaN(cells[cell])) {
                int row = cell / cols;
                int col = cell % cols;
                if (square && row == col) {
                    continue;
                }
                Located from = sources.get(row);
                Located to = targets.get(col);
                throw new ExternalServiceException(
                        REASON_UNRESOLVED_CELL,
                        service,
                        "no route between " + from.getId() + " and " + to.getId(),
                        false
                );
            }
        }
    }

    private static void requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(REASON_INVALID_CONFIG, field, field + " must be non-blank");
        }
    }

    /**
     * Largest block that fits the client's source, target and element limits.
     */
    record BlockShape(int rows, int cols) {
        static BlockShape of(TableServiceClient client, int maxTableSize) {
            int rows = Math.max(1, Math.min(client.maxSourcesPerRequest(), maxTableSize));
            int cols = Math.max(1, Math.min(client.maxTargetsPerRequest(), maxTableSize));
            int maxElements = Math.max(1, client.maxElementsPerRequest());
            while ((long) rows * cols > maxElements) {
                if (rows >= cols) {
                    rows--;
                } else {
                    cols--;
                }
            }
            return new BlockShape(rows, cols);
        }
    }
}
