package org.Aayush.allocator.route;

import lombok.experimental.UtilityClass;
import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.error.SolverException;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.model.Located;

import java.util.List;
import java.util.Objects;

/**
 * Input checks, permutation validation and distance replay shared by route solvers.
 */
@UtilityClass
public class RouteCostEvaluator {
    public static final String REASON_EMPTY_INPUT = "ROUTE_EMPTY_INPUT";
    public static final String REASON_MATRIX_SHAPE = "ROUTE_MATRIX_SHAPE";
    public static final String REASON_INVALID_START = "ROUTE_INVALID_START";
    public static final String REASON_INVALID_OPTIONS = "ROUTE_INVALID_OPTIONS";
    public static final String REASON_NOT_PERMUTATION = "ROUTE_NOT_PERMUTATION";
    public static final String REASON_START_VIOLATED = "ROUTE_START_VIOLATED";

    /**
     * Validates solver inputs before any work.
     */
    public static void validate(List<? extends Located> points, DistanceMatrix matrix, RouteOptions options) {
        Objects.requireNonNull(points, "points");
        Objects.requireNonNull(matrix, "matrix");
        int n = points.size();
        validateOptions(n, options);
        if (!matrix.square() || matrix.rows() != n) {
            throw new ValidationException(
                    REASON_MATRIX_SHAPE,
                    "matrix must be " + n + "x" + n + " but was " + matrix.rows() + "x" + matrix.cols()
            );
        }
    }

    /**
     * Checks the point count, start index and time limit; needs no distance matrix.
     */
    public static void validateOptions(int pointCount, RouteOptions options) {
        Objects.requireNonNull(options, "options");
        if (pointCount == 0) {
            throw new ValidationException(REASON_EMPTY_INPUT, "route input must contain at least one point");
        }
        Integer start = options.getStartIndex();
        if (start != null && (start < 0 || start >= pointCount)) {
            throw new ValidationException(
                    REASON_INVALID_START,
                    Integer.toString(start),
                    "start index must be in [0, " + pointCount + ")"
            );
        }
        if (options.getTimeLimit() != null
                && (options.getTimeLimit().isNegative() || options.getTimeLimit().isZero())) {
            throw new ValidationException(REASON_INVALID_OPTIONS, "timeLimit", "time limit must be positive");
        }
    }

    /**
     * Requested start, or index 0 when the solver may choose.
     */
    public static int startOrFirst(RouteOptions options) {
        return options.getStartIndex() == null ? 0 : options.getStartIndex();
    }

    /**
     * Total distance along {@code order}, plus the closing edge when {@code closed}.
     */
    public static double distance(int[] order, DistanceMatrix matrix, boolean closed) {
        double total = 0.0d;
        for (int i = 1; i < order.length; i++) {
            total += matrix.distance(order[i - 1], order[i]);
        }
        if (closed && order.length > 1) {
            total += matrix.distance(order[order.length - 1], order[0]);
        }
        return total;
    }

    /**
     * Validates a backend order and wraps it as a route with recomputed distance.
     *
     * @throws SolverException when {@code order} is not a permutation or ignores the start.
     */
    public static Route finish(
            int[] order,
            DistanceMatrix matrix,
            RouteOptions options,
            RouteBackend backend,
            String implementationNote
    ) {
        int n = matrix.rows();
        if (order == null || order.length != n) {
            throw new SolverException(
                    REASON_NOT_PERMUTATION,
                    backend.id(),
                    "expected " + n + " indices but got " + (order == null ? "none" : order.length)
            );
        }
        boolean[] seen = new boolean[n];
        for (int index : order) {
            if (index < 0 || index >= n || seen[index]) {
                throw new SolverException(
                        REASON_NOT_PERMUTATION,
                        backend.id(),
                        "index " + index + " is out of range or repeated for n=" + n
                );
            }
            seen[index] = true;
        }
        Integer start = options.getStartIndex();
        if (start != null && order[0] != start) {
            throw new SolverException(
                    REASON_START_VIOLATED,
                    backend.id(),
                    "route starts at " + order[0] + " instead of " + start + " for n=" + n
            );
        }
        return Route.builder()
                .order(order.clone())
                .totalDistance(distance(order, matrix, options.isClosed()))
                .closed(options.isClosed())
                .backend(backend)
                .implementationNote(implementationNote)
                .build();
    }

    /**
     * Route over a single point.
     */
    public static Route singlePoint(RouteOptions options, RouteBackend backend) {
        return Route.builder()
                .order(new int[]{0})
                .totalDistance(0.0d)
                .closed(options.isClosed())
                .backend(backend)
                .implementationNote("single point")
                .build();
    }

    /**
     * Rotates a cyclic order so that it begins at {@code start}.
     */
    public static int[] rotateToStart(int[] cycle, int start) {
        int offset = -1;
        for (int i = 0; i < cycle.length; i++) {
            if (cycle[i] == start) {
                offset = i;
                break;
            }
        }
        if (offset < 0) {
            throw new IllegalArgumentException("start " + start + " is not part of the cycle");
        }
        int[] rotated = new int[cycle.length];
        for (int i = 0; i < cycle.length; i++) {
            rotated[i] = cycle[(offset + i) % cycle.length];
        }
        return rotated;
    }

    /**
     * Undirected weight between two points; directed matrices use the mean of both
     * directions.
     */
    static double undirectedWeight(DistanceMatrix matrix, int i, int j) {
        if (matrix.metric().symmetric()) {
            return matrix.distance(i, j);
        }
        return (matrix.distance(i, j) + matrix.distance(j, i)) * 0.5d;
    }
}
