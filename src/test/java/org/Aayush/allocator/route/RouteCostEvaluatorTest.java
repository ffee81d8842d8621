package org.Aayush.allocator.route;

import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.distance.DistanceMetric;
import org.Aayush.allocator.error.SolverException;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.model.Point;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("RouteCostEvaluator Tests")
class RouteCostEvaluatorTest {
    private static final DistanceMatrix LINE = DistanceMatrix.of(DistanceMetric.PLANAR, new double[][]{
            {0.0d, 1.0d, 3.0d},
            {1.0d, 0.0d, 2.0d},
            {3.0d, 2.0d, 0.0d}
    });

    @Test
    @DisplayName("Distance adds the closing edge only for closed routes")
    void testDistance() {
        int[] order = {0, 1, 2};
        assertEquals(3.0d, RouteCostEvaluator.distance(order, LINE, false), 0.0d);
        assertEquals(6.0d, RouteCostEvaluator.distance(order, LINE, true), 0.0d);
    }

    @Test
    @DisplayName("Finish rejects repeated indices and wrong start")
    void testFinishChecks() {
        SolverException repeated = assertThrows(
                SolverException.class,
                () -> RouteCostEvaluator.finish(new int[]{0, 0, 2}, LINE, RouteOptions.defaults(), RouteBackend.EXACT, "x")
        );
        assertEquals(RouteCostEvaluator.REASON_NOT_PERMUTATION, repeated.reasonCode());

        SolverException shortOrder = assertThrows(
                SolverException.class,
                () -> RouteCostEvaluator.finish(new int[]{0, 1}, LINE, RouteOptions.defaults(), RouteBackend.EXACT, "x")
        );
        assertEquals(RouteCostEvaluator.REASON_NOT_PERMUTATION, shortOrder.reasonCode());

        RouteOptions fromTwo = RouteOptions.builder().startIndex(2).build();
        SolverException start = assertThrows(
                SolverException.class,
                () -> RouteCostEvaluator.finish(new int[]{0, 1, 2}, LINE, fromTwo, RouteBackend.EXACT, "x")
        );
        assertEquals(RouteCostEvaluator.REASON_START_VIOLATED, start.reasonCode());

        Route route = RouteCostEvaluator.finish(new int[]{2, 1, 0}, LINE, fromTwo, RouteBackend.EXACT, "ok");
        assertEquals(6.0d, route.getTotalDistance(), 0.0d);
    }

    @Test
    @DisplayName("Validate rejects shape mismatch and non-positive time limits")
    void testValidate() {
        List<Point> two = List.of(Point.of("a", 0.0d, 0.0d), Point.of("b", 1.0d, 0.0d));
        ValidationException shape = assertThrows(
                ValidationException.class,
                () -> RouteCostEvaluator.validate(two, LINE, RouteOptions.defaults())
        );
        assertEquals(RouteCostEvaluator.REASON_MATRIX_SHAPE, shape.reasonCode());

        List<Point> three = List.of(Point.of("a", 0.0d, 0.0d), Point.of("b", 1.0d, 0.0d), Point.of("c", 3.0d, 0.0d));
        ValidationException limit = assertThrows(
                ValidationException.class,
                () -> RouteCostEvaluator.validate(three, LINE, RouteOptions.builder().timeLimit(Duration.ZERO).build())
        );
        assertEquals(RouteCostEvaluator.REASON_INVALID_OPTIONS, limit.reasonCode());
    }

    @Test
    @DisplayName("Rotation starts a cycle at the requested index")
    void testRotateToStart() {
        assertArrayEquals(new int[]{2, 0, 1}, RouteCostEvaluator.rotateToStart(new int[]{1, 2, 0}, 2));
        assertThrows(IllegalArgumentException.class, () -> RouteCostEvaluator.rotateToStart(new int[]{0, 1}, 5));
    }

    @Test
    @DisplayName("Directed matrices use the mean of both directions as edge weight")
    void testUndirectedWeight() {
        DistanceMatrix directed = DistanceMatrix.of(DistanceMetric.EXTERNAL_ROUTING, new double[][]{
                {0.0d, 4.0d},
                {2.0d, 0.0d}
        });
        assertEquals(3.0d, RouteCostEvaluator.undirectedWeight(directed, 0, 1), 0.0d);
        assertEquals(1.0d, RouteCostEvaluator.undirectedWeight(LINE, 0, 1), 0.0d);
    }
}
