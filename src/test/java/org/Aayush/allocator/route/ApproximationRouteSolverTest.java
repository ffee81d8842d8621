package org.Aayush.allocator.route;

import org.Aayush.allocator.distance.DistanceConfig;
import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.distance.DistanceMatrixProvider;
import org.Aayush.allocator.distance.DistanceMetric;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.model.Point;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ApproximationRouteSolver Tests")
class ApproximationRouteSolverTest {
    private static final DistanceMatrixProvider PROVIDER = new DistanceMatrixProvider();
    private static final List<Point> SQUARE = List.of(
            Point.of("0", 0.0d, 0.0d),
            Point.of("1", 0.0d, 1.0d),
            Point.of("2", 1.0d, 1.0d),
            Point.of("3", 1.0d, 0.0d)
    );

    private final ApproximationRouteSolver solver = new ApproximationRouteSolver();

    @Test
    @DisplayName("Unit square closes into the perimeter tour")
    void testUnitSquare() {
        Route route = solver.solve(SQUARE, planar(SQUARE), RouteOptions.defaults());

        assertArrayEquals(new int[]{0, 1, 2, 3}, route.getOrder());
        assertEquals(4.0d, route.getTotalDistance(), 1e-9d);
        assertTrue(route.isClosed());
        assertEquals(RouteBackend.APPROXIMATION, route.getBackend());
        assertEquals("christofides exact-matching", route.getImplementationNote());
    }

    @Test
    @DisplayName("Double-tree mode returns the MST preorder")
    void testDoubleTree() {
        RouteOptions options = RouteOptions.builder().approximationMode(ApproximationMode.DOUBLE_TREE).build();

        Route route = solver.solve(SQUARE, planar(SQUARE), options);

        assertArrayEquals(new int[]{0, 1, 2, 3}, route.getOrder());
        assertEquals("mst double-tree", route.getImplementationNote());
    }

    @Test
    @DisplayName("Closed tours stay within twice the spanning tree weight")
    void testTwiceMstBound() {
        for (int size : new int[]{5, 12, 40}) {
            for (ApproximationMode mode : ApproximationMode.values()) {
                List<Point> points = randomPoints(size, 31L + size);
                DistanceMatrix matrix = planar(points);
                RouteOptions options = RouteOptions.builder().approximationMode(mode).build();

                Route route = solver.solve(points, matrix, options);

                assertPermutation(route.getOrder(), size);
                assertTrue(
                        route.getTotalDistance() <= 2.0d * MinimumSpanningTree.weight(matrix) + 1e-9d,
                        "n=" + size + " mode=" + mode
                );
            }
        }
    }

    @Test
    @DisplayName("Requested start index leads the route")
    void testStartIndex() {
        List<Point> points = randomPoints(15, 5L);
        DistanceMatrix matrix = planar(points);

        Route route = solver.solve(points, matrix, RouteOptions.builder().startIndex(7).build());

        assertEquals(7, route.getOrder()[0]);
        assertPermutation(route.getOrder(), 15);
    }

    @Test
    @DisplayName("Open routes omit the closing edge")
    void testOpenRoute() {
        List<Point> points = randomPoints(10, 9L);
        DistanceMatrix matrix = planar(points);

        Route route = solver.solve(points, matrix, RouteOptions.builder().closed(false).build());

        assertFalse(route.isClosed());
        assertEquals(RouteCostEvaluator.distance(route.getOrder(), matrix, false), route.getTotalDistance(), 1e-9d);
    }

    @Test
    @DisplayName("Single point and empty input edge cases")
    void testDegenerateInputs() {
        List<Point> single = List.of(Point.of("solo", 3.0d, 4.0d));
        Route route = solver.solve(single, planar(single), RouteOptions.defaults());
        assertArrayEquals(new int[]{0}, route.getOrder());
        assertEquals(0.0d, route.getTotalDistance(), 0.0d);
        assertEquals("single point", route.getImplementationNote());

        ValidationException ex = assertThrows(
                ValidationException.class,
                () -> solver.solve(List.of(), DistanceMatrix.of(DistanceMetric.PLANAR, new double[0][0]), RouteOptions.defaults())
        );
        assertEquals(RouteCostEvaluator.REASON_EMPTY_INPUT, ex.reasonCode());
    }

    static DistanceMatrix planar(List<Point> points) {
        return PROVIDER.compute(points, DistanceMetric.PLANAR, DistanceConfig.defaults());
    }

    static List<Point> randomPoints(int n, long seed) {
        Random random = new Random(seed);
        List<Point> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            points.add(Point.of("p" + i, random.nextDouble() * 100.0d, random.nextDouble() * 100.0d));
        }
        return points;
    }

    static void assertPermutation(int[] order, int n) {
        int[] sorted = order.clone();
        Arrays.sort(sorted);
        for (int i = 0; i < n; i++) {
            assertEquals(i, sorted[i]);
        }
        assertEquals(n, order.length);
    }
}
