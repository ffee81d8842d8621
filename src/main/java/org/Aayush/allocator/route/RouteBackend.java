package org.Aayush.allocator.route;

import org.Aayush.allocator.error.ValidationException;

import java.util.Locale;

/**
 * Route solver backends, selected by value.
 */
public enum RouteBackend {
    /** OR-Tools routing model with guided local search. */
    EXACT("exact", "ortools"),
    /** MST based approximation (double tree or Christofides). */
    APPROXIMATION("approximation", "christofides"),
    /** OSRM trip service. */
    EXTERNAL_SERVICE("external-service", "osrm"),
    /** Greedy next-nearest unvisited point. */
    NEAREST_NEIGHBOR("nearest-neighbor", "greedy"),
    /** Google Directions waypoint optimization. */
    GOOGLE_DIRECTIONS("google-directions", "google");

    public static final String REASON_UNKNOWN_BACKEND = "ROUTE_UNKNOWN_BACKEND";

    private final String id;
    private final String alias;

    RouteBackend(String id, String alias) {
        this.id = id;
        this.alias = alias;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a backend from its id or alias (case-insensitive).
     */
    public static RouteBackend fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(REASON_UNKNOWN_BACKEND, "route backend must be non-blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (RouteBackend backend : values()) {
            if (backend.id.equals(normalized) || backend.alias.equals(normalized)) {
                return backend;
            }
        }
        throw new ValidationException(
                REASON_UNKNOWN_BACKEND,
                value,
                "unknown route backend; supported: exact, approximation, external-service, nearest-neighbor, google-directions"
        );
    }
}
