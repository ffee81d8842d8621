package org.Aayush.allocator.route;

import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.model.Located;

import java.util.List;

/**
 * Orders a point subset into a path or tour minimizing total matrix distance.
 */
public interface RouteSolver {
    /**
     * Backend implemented by this solver.
     */
    RouteBackend backend();

    /**
     * Backend-specific checks that need no distance matrix, run before one is computed.
     *
     * @throws org.Aayush.allocator.error.ValidationException when the backend cannot take the input.
     */
    default void preflight(int pointCount, RouteOptions options) {
    }

    /**
     * @param points points in input order.
     * @param matrix square matrix over {@code points}.
     * @param options start, time limit and closure options.
     * @return a permutation of {@code [0, n)} with recomputed distance.
     * @throws org.Aayush.allocator.error.ValidationException on empty input or bad options.
     * @throws org.Aayush.allocator.error.SolverException when the backend yields no valid permutation.
     */
    Route solve(List<? extends Located> points, DistanceMatrix matrix, RouteOptions options);
}
