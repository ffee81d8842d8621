package org.Aayush.allocator.route;

import org.Aayush.allocator.distance.DistanceConfig;
import org.Aayush.allocator.error.ValidationException;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable backend-to-solver registry.
 */
public final class RouteSolverRegistry {
    private final Map<RouteBackend, RouteSolver> solverByBackend;

    /**
     * Creates a registry with built-in solvers; the trip backend uses default service settings.
     */
    public RouteSolverRegistry() {
        this(DistanceConfig.defaults(), List.of());
    }

    /**
     * Creates a registry by merging built-ins with custom solvers.
     *
     * <p>Custom solvers replace built-ins registered for the same backend.</p>
     */
    public RouteSolverRegistry(DistanceConfig serviceConfig, Collection<? extends RouteSolver> customSolvers) {
        EnumMap<RouteBackend, RouteSolver> merged = new EnumMap<>(RouteBackend.class);
        for (RouteSolver solver : List.of(
                new OrToolsRouteSolver(),
                new ApproximationRouteSolver(),
                new ExternalTripRouteSolver(Objects.requireNonNull(serviceConfig, "serviceConfig")),
                new NearestNeighborRouteSolver(),
                new GoogleDirectionsRouteSolver(serviceConfig)
        )) {
            merged.put(solver.backend(), solver);
        }
        if (customSolvers != null) {
            for (RouteSolver solver : customSolvers) {
                RouteSolver nonNull = Objects.requireNonNull(solver, "solver");
                merged.put(Objects.requireNonNull(nonNull.backend(), "backend"), nonNull);
            }
        }
        this.solverByBackend = Map.copyOf(merged);
    }

    public RouteSolver solver(RouteBackend backend) {
        RouteSolver solver = solverByBackend.get(Objects.requireNonNull(backend, "backend"));
        if (solver == null) {
            throw new ValidationException(RouteBackend.REASON_UNKNOWN_BACKEND, backend.id(), "no solver registered");
        }
        return solver;
    }

    public Set<RouteBackend> backends() {
        return solverByBackend.keySet();
    }
}
