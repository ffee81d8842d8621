package org.Aayush.allocator.route;

import lombok.Builder;
import lombok.Value;

/**
 * Ordered visiting sequence over a point subset.
 *
 * <p>{@code totalDistance} is always recomputed from the matrix, including the closing
 * edge when {@code closed} is set.</p>
 */
@Value
@Builder
public class Route {
    /** Permutation of input indices in visiting order. */
    int[] order;
    double totalDistance;
    boolean closed;
    RouteBackend backend;
    /** Backend note for observability. */
    String implementationNote;

    /**
     * Returns a defensive copy of the visiting order.
     */
    public int[] getOrder() {
        return order.clone();
    }

    public int size() {
        return order.length;
    }
}
