package org.Aayush.allocator.route;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.distance.DistanceConfig;
import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.error.SolverException;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.external.ExternalCallExecutor;
import org.Aayush.allocator.external.HttpJsonTransport;
import org.Aayush.allocator.external.OsrmClient;
import org.Aayush.allocator.model.Located;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Route backend delegating to the OSRM {@code trip} service.
 *
 * <p>The service always plans a round trip. A requested start is sent first and pinned
 * as trip source. Open paths drop the closing edge; without a start the cycle is cut at
 * its longest edge. The returned order is validated and its distance recomputed from
 * the local matrix.</p>
 */
@Slf4j
public final class ExternalTripRouteSolver implements RouteSolver {
    public static final String REASON_TOO_MANY_LOCATIONS = "ROUTE_TOO_MANY_LOCATIONS";
    public static final String REASON_DISCONNECTED = "ROUTE_DISCONNECTED";

    private final DistanceConfig config;

    public ExternalTripRouteSolver(DistanceConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public RouteBackend backend() {
        return RouteBackend.EXTERNAL_SERVICE;
    }

    @Override
    public void preflight(int pointCount, RouteOptions options) {
        if (pointCount > options.getMaxExternalLocations()) {
            throw new ValidationException(
                    REASON_TOO_MANY_LOCATIONS,
                    Integer.toString(pointCount),
                    "trip service accepts at most " + options.getMaxExternalLocations() + " locations"
            );
        }
    }

    @Override
    public Route solve(List<? extends Located> points, DistanceMatrix matrix, RouteOptions options) {
        RouteCostEvaluator.validate(points, matrix, options);
        int n = points.size();
        preflight(n, options);
        if (n == 1) {
            return RouteCostEvaluator.singlePoint(options, backend());
        }

        Integer start = options.getStartIndex();
        int[] localToInput = new int[n];
        List<Located> locations = new ArrayList<>(n);
        int cursor = 0;
        if (start != null) {
            localToInput[cursor++] = start;
        }
        for (int i = 0; i < n; i++) {
            if (start == null || i != start) {
                localToInput[cursor++] = i;
            }
        }
        for (int index : localToInput) {
            locations.add(points.get(index));
        }

        OsrmClient client = new OsrmClient(
                new HttpJsonTransport(config.getRequestTimeout()),
                config.getRoutingBaseUrl(),
                config.getRoutingProfile(),
                config.getMaxTableSize()
        );
        OsrmClient.TripPlan plan;
        try (ExternalCallExecutor executor = new ExternalCallExecutor(OsrmClient.SERVICE_NAME, 1, config.getRetryPolicy())) {
            plan = executor.call(() -> client.trip(locations, start != null));
        }
        if (plan.tripCount() > 1) {
            throw new SolverException(
                    REASON_DISCONNECTED,
                    backend().id(),
                    "trip service split n=" + n + " locations into " + plan.tripCount() + " trips"
            );
        }

        int[] cycle = new int[n];
        int[] local = plan.order();
        for (int i = 0; i < n; i++) {
            cycle[i] = localToInput[local[i]];
        }
        int[] order;
        if (start != null) {
            order = RouteCostEvaluator.rotateToStart(cycle, start);
        } else if (options.isClosed()) {
            order = cycle;
        } else {
            order = cutAtLongestEdge(cycle, matrix);
        }
        log.debug("osrm trip for n={} reported {} m", n, plan.distance());
        return RouteCostEvaluator.finish(order, matrix, options, backend(), "osrm trip");
    }

    static int[] cutAtLongestEdge(int[] cycle, DistanceMatrix matrix) {
        int n = cycle.length;
        int cut = 0;
        double longest = -1.0d;
        for (int i = 0; i < n; i++) {
            double d = matrix.distance(cycle[i], cycle[(i + 1) % n]);
            if (d > longest) {
                longest = d;
                cut = i;
            }
        }
        return RouteCostEvaluator.rotateToStart(cycle, cycle[(cut + 1) % n]);
    }
}
