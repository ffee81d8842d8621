package org.Aayush.allocator.distance;

import org.Aayush.allocator.error.ExternalServiceException;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.external.HttpJsonTransport;
import org.Aayush.allocator.external.RetryPolicy;
import org.Aayush.allocator.external.TableBlock;
import org.Aayush.allocator.external.TableServiceClient;
import org.Aayush.allocator.model.Located;
import org.Aayush.allocator.model.Point;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ExternalTableStrategy Tests")
class ExternalTableStrategyTest {
    private static final DistanceConfig FAST_CONFIG = DistanceConfig.builder()
            .retryPolicy(RetryPolicy.builder().initialBackoff(Duration.ofMillis(1L)).maxBackoff(Duration.ofMillis(2L)).build())
            .build();

    @Test
    @DisplayName("Element-limited client is split into blocks and stitched in input order")
    void testChunkingAndStitching() {
        FakeClient client = new FakeClient(25, 25, 100);
        ExternalTableStrategy strategy = strategyFor(client);
        List<Point> points = grid(23);

        DistanceMatrix matrix = strategy.computeSquare(points, FAST_CONFIG);

        assertEquals(23, matrix.rows());
        for (int i = 0; i < 23; i++) {
            for (int j = 0; j < 23; j++) {
                double expected = i == j ? 0.0d : FakeClient.cell(points.get(i), points.get(j));
                assertEquals(expected, matrix.distance(i, j), 0.0d);
            }
        }
        // 10x10 blocks: 3 row bands by 3 column bands.
        assertEquals(9, client.requests.size());
        for (int[] shape : client.requests) {
            assertTrue(shape[0] * shape[1] <= 100);
        }
    }

    @Test
    @DisplayName("Configured table size caps block dimensions")
    void testMaxTableSizeCapsBlocks() {
        FakeClient client = new FakeClient(1000, 1000, Integer.MAX_VALUE);
        ExternalTableStrategy strategy = strategyFor(client);

        strategy.computeRectangular(grid(5), grid(7), FAST_CONFIG.toBuilder().maxTableSize(3).build());

        // 2 row bands by 3 column bands.
        assertEquals(6, client.requests.size());
        for (int[] shape : client.requests) {
            assertTrue(shape[0] <= 3 && shape[1] <= 3);
        }
    }

    @Test
    @DisplayName("Block shape shrinks the larger side until the element limit holds")
    void testBlockShape() {
        ExternalTableStrategy.BlockShape shape = ExternalTableStrategy.BlockShape.of(new FakeClient(25, 25, 100), 100);
        assertEquals(10, shape.rows());
        assertEquals(10, shape.cols());

        ExternalTableStrategy.BlockShape capped = ExternalTableStrategy.BlockShape.of(new FakeClient(25, 25, 100), 4);
        assertEquals(4, capped.rows());
        assertEquals(4, capped.cols());
    }

    @Test
    @DisplayName("Unresolved off-diagonal cell fails the whole call instead of zero-filling")
    void testUnresolvedCellRejected() {
        FakeClient client = new FakeClient(100, 100, Integer.MAX_VALUE);
        client.unresolvedRow = 1;
        client.unresolvedCol = 2;

        ExternalServiceException ex = assertThrows(
                ExternalServiceException.class,
                () -> strategyFor(client).computeSquare(grid(4), FAST_CONFIG)
        );
        assertEquals(ExternalTableStrategy.REASON_UNRESOLVED_CELL, ex.reasonCode());
        assertTrue(ex.getMessage().contains("p1"));
        assertTrue(ex.getMessage().contains("p2"));
    }

    @Test
    @DisplayName("Unresolved diagonal cell of a square table is forced to zero")
    void testUnresolvedDiagonalIgnored() {
        FakeClient client = new FakeClient(100, 100, Integer.MAX_VALUE);
        client.unresolvedRow = 2;
        client.unresolvedCol = 2;

        DistanceMatrix matrix = strategyFor(client).computeSquare(grid(4), FAST_CONFIG);

        assertEquals(0.0d, matrix.distance(2, 2), 0.0d);
    }

    @Test
    @DisplayName("Transient failures are retried and permanent ones surface immediately")
    void testRetryClassification() {
        FakeClient flaky = new FakeClient(100, 100, Integer.MAX_VALUE);
        flaky.transientFailuresLeft.set(2);

        DistanceMatrix matrix = strategyFor(flaky).computeSquare(grid(3), FAST_CONFIG);
        assertEquals(3, matrix.rows());
        assertEquals(3, flaky.attempts.get());

        FakeClient broken = new FakeClient(100, 100, Integer.MAX_VALUE);
        broken.permanentFailure = true;
        ExternalServiceException ex = assertThrows(
                ExternalServiceException.class,
                () -> strategyFor(broken).computeSquare(grid(3), FAST_CONFIG)
        );
        assertEquals(HttpJsonTransport.REASON_AUTH_REJECTED, ex.reasonCode());
        assertEquals(1, broken.attempts.get());
    }

    @Test
    @DisplayName("Retries stop after the configured attempt budget")
    void testRetryBudgetExhausted() {
        FakeClient flaky = new FakeClient(100, 100, Integer.MAX_VALUE);
        flaky.transientFailuresLeft.set(10);
        DistanceConfig config = FAST_CONFIG.toBuilder()
                .retryPolicy(FAST_CONFIG.getRetryPolicy().toBuilder().maxAttempts(3).build())
                .build();

        ExternalServiceException ex = assertThrows(
                ExternalServiceException.class,
                () -> strategyFor(flaky).computeSquare(grid(2), config)
        );
        assertTrue(ex.transientFailure());
        assertEquals(3, flaky.attempts.get());
    }

    @Test
    @DisplayName("Durations are stitched when requested")
    void testDurations() {
        FakeClient client = new FakeClient(2, 2, Integer.MAX_VALUE);

        DistanceMatrix matrix = strategyFor(client).computeSquare(
                grid(3), FAST_CONFIG.toBuilder().includeDurations(true).build());

        assertTrue(matrix.hasDurations());
        assertEquals(matrix.distance(0, 2) / 10.0d, matrix.duration(0, 2), 1e-12);
        assertEquals(0.0d, matrix.duration(1, 1), 0.0d);
    }

    @Test
    @DisplayName("Invalid concurrency or table size is rejected before fetching")
    void testConfigValidation() {
        ExternalTableStrategy strategy = strategyFor(new FakeClient(10, 10, 100));
        assertThrows(
                ValidationException.class,
                () -> strategy.validateConfig(FAST_CONFIG.toBuilder().maxTableSize(0).build())
        );
        assertThrows(
                ValidationException.class,
                () -> strategy.validateConfig(FAST_CONFIG.toBuilder().maxConcurrentRequests(0).build())
        );
    }

    @Test
    @DisplayName("Client concurrency cap overrides the configured request concurrency")
    void testClientConcurrencyCap() {
        FakeClient client = new FakeClient(5, 5, 25);
        client.concurrencyCap = 1;
        client.pauseMillis = 5L;
        ExternalTableStrategy strategy = strategyFor(client);

        strategy.computeSquare(grid(20), FAST_CONFIG.toBuilder().maxConcurrentRequests(8).build());

        assertEquals(16, client.requests.size());
        assertEquals(1, client.peakInFlight.get());
    }

    private static ExternalTableStrategy strategyFor(TableServiceClient client) {
        return new ExternalTableStrategy(DistanceMetric.EXTERNAL_ROUTING, config -> client, config -> { });
    }

    private static List<Point> grid(int n) {
        List<Point> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            points.add(Point.of("p" + i, 10.0d + 0.01d * i, 50.0d + 0.005d * (i % 4)));
        }
        return points;
    }

    private static final class FakeClient implements TableServiceClient {
        private final int maxSources;
        private final int maxTargets;
        private final int maxElements;
        private final List<int[]> requests = Collections.synchronizedList(new ArrayList<>());
        private final AtomicInteger attempts = new AtomicInteger();
        private final AtomicInteger transientFailuresLeft = new AtomicInteger();
        private volatile boolean permanentFailure;
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger peakInFlight = new AtomicInteger();
        private int concurrencyCap = Integer.MAX_VALUE;
        private long pauseMillis;
        private int unresolvedRow = -1;
        private int unresolvedCol = -1;

        FakeClient(int maxSources, int maxTargets, int maxElements) {
            this.maxSources = maxSources;
            this.maxTargets = maxTargets;
            this.maxElements = maxElements;
        }

        static double cell(Located from, Located to) {
            return 1000.0d * Math.abs(from.getLongitude() - to.getLongitude())
                    + 700.0d * Math.abs(from.getLatitude() - to.getLatitude())
                    + 1.0d;
        }

        @Override
        public String serviceName() {
            return "fake";
        }

        @Override
        public int maxSourcesPerRequest() {
            return maxSources;
        }

        @Override
        public int maxTargetsPerRequest() {
            return maxTargets;
        }

        @Override
        public int maxElementsPerRequest() {
            return maxElements;
        }

        @Override
        public int maxConcurrentRequests() {
            return concurrencyCap;
        }

        @Override
        public TableBlock fetch(List<? extends Located> sources, List<? extends Located> targets, boolean includeDurations) {
            peakInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                if (pauseMillis > 0L) {
                    Thread.sleep(pauseMillis);
                }
                return fetchBlock(sources, targets, includeDurations);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(ex);
            } finally {
                inFlight.decrementAndGet();
            }
        }

        private TableBlock fetchBlock(List<? extends Located> sources, List<? extends Located> targets, boolean includeDurations) {
            attempts.incrementAndGet();
            if (permanentFailure) {
                throw new ExternalServiceException(HttpJsonTransport.REASON_AUTH_REJECTED, "fake", "denied", false);
            }
            if (transientFailuresLeft.getAndDecrement() > 0) {
                throw new ExternalServiceException(HttpJsonTransport.REASON_SERVER_ERROR, "fake", "busy", true);
            }
            requests.add(new int[]{sources.size(), targets.size()});
            double[] distances = new double[sources.size() * targets.size()];
            double[] durations = includeDurations ? new double[distances.length] : null;
            for (int i = 0; i < sources.size(); i++) {
                for (int j = 0; j < targets.size(); j++) {
                    double value = cell(sources.get(i), targets.get(j));
                    if (sources.get(i).getId().equals("p" + unresolvedRow)
                            && targets.get(j).getId().equals("p" + unresolvedCol)) {
                        value = Double.NaN;
                    }
                    distances[i * targets.size() + j] = value;
                    if (durations != null) {
                        durations[i * targets.size() + j] = value / 10.0d;
                    }
                }
            }
            return new TableBlock(sources.size(), targets.size(), distances, durations);
        }
    }
}
