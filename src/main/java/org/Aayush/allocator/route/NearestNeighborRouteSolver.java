package org.Aayush.allocator.route;

import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.model.Located;

import java.util.List;

/**
 * Greedy next-nearest-unvisited construction; ties go to the smaller index.
 */
public final class NearestNeighborRouteSolver implements RouteSolver {

    @Override
    public RouteBackend backend() {
        return RouteBackend.NEAREST_NEIGHBOR;
    }

    @Override
    public Route solve(List<? extends Located> points, DistanceMatrix matrix, RouteOptions options) {
        RouteCostEvaluator.validate(points, matrix, options);
        int n = points.size();
        if (n == 1) {
            return RouteCostEvaluator.singlePoint(options, backend());
        }
        boolean[] visited = new boolean[n];
        int[] order = new int[n];
        int current = RouteCostEvaluator.startOrFirst(options);
        order[0] = current;
        visited[current] = true;
        for (int step = 1; step < n; step++) {
            int next = -1;
            double nextDistance = Double.POSITIVE_INFINITY;
            for (int candidate = 0; candidate < n; candidate++) {
                if (visited[candidate]) {
                    continue;
                }
                double d = matrix.distance(current, candidate);
                if (next < 0 || d < nextDistance) {
                    next = candidate;
                    nextDistance = d;
                }
            }
            order[step] = next;
            visited[next] = true;
            current = next;
        }
        return RouteCostEvaluator.finish(order, matrix, options, backend(), "nearest neighbor");
    }
}
