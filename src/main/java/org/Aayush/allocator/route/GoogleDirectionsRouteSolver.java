package org.Aayush.allocator.route;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.distance.DistanceConfig;
import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.external.ExternalCallExecutor;
import org.Aayush.allocator.external.GoogleDirectionsClient;
import org.Aayush.allocator.external.HttpJsonTransport;
import org.Aayush.allocator.model.Located;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Route backend delegating waypoint ordering to the Google Directions service.
 *
 * <p>The service optimizes a loop that leaves from and returns to one origin: the
 * requested start, or the first point. Open paths drop the closing leg; without a
 * start the loop is cut at its longest edge. Input is limited to
 * {@link GoogleDirectionsClient#MAX_LOCATIONS} points.</p>
 */
@Slf4j
public final class GoogleDirectionsRouteSolver implements RouteSolver {
    public static final String REASON_MISSING_CREDENTIALS = "ROUTE_MISSING_CREDENTIALS";

    private final DistanceConfig config;

    public GoogleDirectionsRouteSolver(DistanceConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public RouteBackend backend() {
        return RouteBackend.GOOGLE_DIRECTIONS;
    }

    @Override
    public void preflight(int pointCount, RouteOptions options) {
        if (pointCount > GoogleDirectionsClient.MAX_LOCATIONS) {
            throw new ValidationException(
                    ExternalTripRouteSolver.REASON_TOO_MANY_LOCATIONS,
                    Integer.toString(pointCount),
                    "directions service accepts at most " + GoogleDirectionsClient.MAX_LOCATIONS + " locations"
            );
        }
        String key = config.getMappingApiKey();
        if (key == null || key.isBlank()) {
            throw new ValidationException(
                    REASON_MISSING_CREDENTIALS,
                    backend().id(),
                    "mapping API key is required; set ALLOCATOR_MAPPING_API_KEY"
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

        int origin = RouteCostEvaluator.startOrFirst(options);
        int[] localToInput = new int[n];
        localToInput[0] = origin;
        int cursor = 1;
        for (int i = 0; i < n; i++) {
            if (i != origin) {
                localToInput[cursor++] = i;
            }
        }
        List<Located> locations = new ArrayList<>(n);
        for (int index : localToInput) {
            locations.add(points.get(index));
        }

        GoogleDirectionsClient client = new GoogleDirectionsClient(
                new HttpJsonTransport(config.getRequestTimeout()),
                config.getDirectionsBaseUrl(),
                config.getMappingApiKey()
        );
        GoogleDirectionsClient.LoopPlan plan;
        try (ExternalCallExecutor executor =
                     new ExternalCallExecutor(GoogleDirectionsClient.SERVICE_NAME, 1, config.getRetryPolicy())) {
            plan = executor.call(() -> client.optimizeLoop(locations));
        }

        int[] cycle = new int[n];
        int[] local = plan.order();
        for (int i = 0; i < n; i++) {
            cycle[i] = localToInput[local[i]];
        }
        int[] order = options.getStartIndex() == null && !options.isClosed()
                ? ExternalTripRouteSolver.cutAtLongestEdge(cycle, matrix)
                : cycle;
        log.debug("google directions loop for n={} reported {} m", n, plan.distance());
        return RouteCostEvaluator.finish(order, matrix, options, backend(), "google directions optimize_waypoints");
    }
}
