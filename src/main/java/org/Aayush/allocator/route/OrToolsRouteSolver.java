package org.Aayush.allocator.route;

import com.google.ortools.Loader;
import com.google.ortools.constraintsolver.Assignment;
import com.google.ortools.constraintsolver.FirstSolutionStrategy;
import com.google.ortools.constraintsolver.LocalSearchMetaheuristic;
import com.google.ortools.constraintsolver.RoutingIndexManager;
import com.google.ortools.constraintsolver.RoutingModel;
import com.google.ortools.constraintsolver.RoutingSearchParameters;
import com.google.ortools.constraintsolver.main;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.error.SolverException;
import org.Aayush.allocator.model.Located;

import java.time.Duration;
import java.util.List;

/**
 * Single-vehicle OR-Tools routing model.
 *
 * <p>Arc costs are matrix distances scaled to integers. The first solution comes from
 * {@code PATH_CHEAPEST_ARC} and is improved by guided local search until the time limit.
 * Open paths add a dummy end node reached at zero cost; without a fixed start the dummy
 * node also serves as depot so both ends are free.</p>
 */
@Slf4j
public final class OrToolsRouteSolver implements RouteSolver {
    public static final String REASON_SOLVER_UNAVAILABLE = "ROUTE_SOLVER_UNAVAILABLE";
    public static final String REASON_NO_SOLUTION = "ROUTE_NO_SOLUTION";

    static final long COST_RESOLUTION = 1_000_000L;

    private static volatile boolean nativeLoaded;

    @Override
    public RouteBackend backend() {
        return RouteBackend.EXACT;
    }

    @Override
    public Route solve(List<? extends Located> points, DistanceMatrix matrix, RouteOptions options) {
        RouteCostEvaluator.validate(points, matrix, options);
        int n = points.size();
        if (n == 1) {
            return RouteCostEvaluator.singlePoint(options, backend());
        }
        ensureNativeLibraries();

        Integer start = options.getStartIndex();
        boolean open = !options.isClosed();
        int dummy = open ? n : -1;
        int nodeCount = open ? n + 1 : n;
        long[][] costs = scaledCosts(matrix, dummy);

        RoutingIndexManager manager;
        if (!open) {
            manager = new RoutingIndexManager(nodeCount, 1, start == null ? 0 : start);
        } else if (start != null) {
            manager = new RoutingIndexManager(nodeCount, 1, new int[]{start}, new int[]{dummy});
        } else {
            manager = new RoutingIndexManager(nodeCount, 1, dummy);
        }
        RoutingModel routing = new RoutingModel(manager);
        int transit = routing.registerTransitCallback((long fromIndex, long toIndex) ->
                costs[manager.indexToNode(fromIndex)][manager.indexToNode(toIndex)]);
        routing.setArcCostEvaluatorOfAllVehicles(transit);

        Duration limit = options.effectiveTimeLimit();
        RoutingSearchParameters parameters = main.defaultRoutingSearchParameters()
                .toBuilder()
                .setFirstSolutionStrategy(FirstSolutionStrategy.Value.PATH_CHEAPEST_ARC)
                .setLocalSearchMetaheuristic(LocalSearchMetaheuristic.Value.GUIDED_LOCAL_SEARCH)
                .setTimeLimit(com.google.protobuf.Duration.newBuilder()
                        .setSeconds(limit.getSeconds())
                        .setNanos(limit.getNano())
                        .build())
                .build();

        long startNanos = System.nanoTime();
        Assignment solution = routing.solveWithParameters(parameters);
        if (solution == null) {
            throw new SolverException(
                    REASON_NO_SOLUTION,
                    backend().id(),
                    "no solution within " + limit.toMillis() + " ms for n=" + n
            );
        }

        IntArrayList order = new IntArrayList(n);
        long index = routing.start(0);
        while (!routing.isEnd(index)) {
            int node = manager.indexToNode(index);
            if (node != dummy) {
                order.add(node);
            }
            index = solution.value(routing.nextVar(index));
        }
        log.debug("or-tools solved n={} in {} ms", n, (System.nanoTime() - startNanos) / 1_000_000L);
        return RouteCostEvaluator.finish(
                order.toIntArray(),
                matrix,
                options,
                backend(),
                "or-tools guided-local-search limit=" + limit.toMillis() + "ms"
        );
    }

    /**
     * Integer arc costs; arcs touching the dummy node cost nothing.
     */
    static long[][] scaledCosts(DistanceMatrix matrix, int dummy) {
        int n = matrix.rows();
        int size = dummy >= 0 ? n + 1 : n;
        double max = 0.0d;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                max = Math.max(max, matrix.distance(i, j));
            }
        }
        double scale = max > 0.0d ? COST_RESOLUTION / max : 0.0d;
        long[][] costs = new long[size][size];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                costs[i][j] = Math.round(matrix.distance(i, j) * scale);
            }
        }
        return costs;
    }

    private static void ensureNativeLibraries() {
        if (nativeLoaded) {
            return;
        }
        synchronized (OrToolsRouteSolver.class) {
            if (nativeLoaded) {
                return;
            }
            try {
                Loader.loadNativeLibraries();
            } catch (RuntimeException | LinkageError ex) {
                throw new SolverException(
                        REASON_SOLVER_UNAVAILABLE,
                        RouteBackend.EXACT.id(),
                        "could not load OR-Tools native libraries: " + ex.getMessage(),
                        ex
                );
            }
            nativeLoaded = true;
        }
    }
}
