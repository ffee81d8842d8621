package org.Aayush.allocator.distance;

import org.Aayush.allocator.error.ValidationException;

import java.util.Locale;

/**
 * Supported distance metrics, selected by value.
 *
 * <p>{@code PLANAR} and {@code GREAT_CIRCLE} are deterministic pure functions of the
 * coordinates. {@code EXTERNAL_ROUTING} (OSRM table service) and {@code EXTERNAL_MAPPING}
 * (Google Distance Matrix) delegate to remote services and yield directed road
 * distances, so their matrices are not required to be symmetric.</p>
 */
public enum DistanceMetric {
    PLANAR("planar", "euclidean", true, false),
    GREAT_CIRCLE("great-circle", "haversine", true, false),
    EXTERNAL_ROUTING("external-routing", "osrm", false, true),
    EXTERNAL_MAPPING("external-mapping", "google", false, true);

    public static final String REASON_UNKNOWN_METRIC = "DIST_UNKNOWN_METRIC";

    private final String id;
    private final String alias;
    private final boolean symmetric;
    private final boolean external;

    DistanceMetric(String id, String alias, boolean symmetric, boolean external) {
        this.id = id;
        this.alias = alias;
        this.symmetric = symmetric;
        this.external = external;
    }

    public String id() {
        return id;
    }

    public boolean symmetric() {
        return symmetric;
    }

    public boolean external() {
        return external;
    }

    /**
     * @return true when coordinates must be valid WGS84 longitude/latitude.
     */
    public boolean geographic() {
        return this != PLANAR;
    }

    /**
     * Resolves a metric from its id or legacy alias (case-insensitive).
     *
     * @throws ValidationException when the id is unknown.
     */
    public static DistanceMetric fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(REASON_UNKNOWN_METRIC, "distance metric must be non-blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (DistanceMetric metric : values()) {
            if (metric.id.equals(normalized) || metric.alias.equals(normalized)) {
                return metric;
            }
        }
        throw new ValidationException(
                REASON_UNKNOWN_METRIC,
                value,
                "unknown distance metric; supported: planar, great-circle, external-routing, external-mapping"
        );
    }
}
