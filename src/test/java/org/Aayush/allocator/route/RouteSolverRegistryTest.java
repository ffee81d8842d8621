package org.Aayush.allocator.route;

import org.Aayush.allocator.distance.DistanceConfig;
import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.model.Located;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("RouteSolverRegistry Tests")
class RouteSolverRegistryTest {

    @Test
    @DisplayName("Built-in solvers cover every backend")
    void testBuiltIns() {
        RouteSolverRegistry registry = new RouteSolverRegistry();

        assertEquals(EnumSet.allOf(RouteBackend.class), EnumSet.copyOf(registry.backends()));
        assertInstanceOf(OrToolsRouteSolver.class, registry.solver(RouteBackend.EXACT));
        assertInstanceOf(ApproximationRouteSolver.class, registry.solver(RouteBackend.APPROXIMATION));
        assertInstanceOf(ExternalTripRouteSolver.class, registry.solver(RouteBackend.EXTERNAL_SERVICE));
        assertInstanceOf(NearestNeighborRouteSolver.class, registry.solver(RouteBackend.NEAREST_NEIGHBOR));
    }

    @Test
    @DisplayName("Custom solver replaces the built-in for its backend")
    void testCustomOverride() {
        RouteSolver custom = new RouteSolver() {
            @Override
            public RouteBackend backend() {
                return RouteBackend.EXACT;
            }

            @Override
            public Route solve(List<? extends Located> points, DistanceMatrix matrix, RouteOptions options) {
                return RouteCostEvaluator.singlePoint(options, backend());
            }
        };

        RouteSolverRegistry registry = new RouteSolverRegistry(DistanceConfig.defaults(), List.of(custom));

        assertSame(custom, registry.solver(RouteBackend.EXACT));
    }

    @Test
    @DisplayName("Backend ids and aliases resolve")
    void testBackendIds() {
        assertEquals(RouteBackend.EXACT, RouteBackend.fromId("ortools"));
        assertEquals(RouteBackend.APPROXIMATION, RouteBackend.fromId("Christofides"));
        assertEquals(RouteBackend.EXTERNAL_SERVICE, RouteBackend.fromId("external_service"));
        assertEquals(RouteBackend.NEAREST_NEIGHBOR, RouteBackend.fromId(" nearest-neighbor "));

        ValidationException ex = assertThrows(ValidationException.class, () -> RouteBackend.fromId("genetic"));
        assertEquals(RouteBackend.REASON_UNKNOWN_BACKEND, ex.reasonCode());
        assertThrows(ValidationException.class, () -> RouteBackend.fromId(" "));
    }
}
