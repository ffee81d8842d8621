package org.Aayush.allocator.cluster;

import org.Aayush.allocator.error.ValidationException;

import java.util.Locale;

/**
 * Supported clustering paths, selected by value.
 */
public enum ClusteringMethod {
    KMEANS("kmeans", "k-means"),
    GRAPH_PARTITION("graph-partition", "kahip");

    public static final String REASON_UNKNOWN_METHOD = "CLUSTER_UNKNOWN_METHOD";

    private final String id;
    private final String alias;

    ClusteringMethod(String id, String alias) {
        this.id = id;
        this.alias = alias;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a method from its id or alias (case-insensitive).
     */
    public static ClusteringMethod fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(REASON_UNKNOWN_METHOD, "clustering method must be non-blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ClusteringMethod method : values()) {
            if (method.id.equals(normalized) || method.alias.equals(normalized)) {
                return method;
            }
        }
        throw new ValidationException(
                REASON_UNKNOWN_METHOD,
                value,
                "unknown clustering method; supported: kmeans, graph-partition"
        );
    }
}
