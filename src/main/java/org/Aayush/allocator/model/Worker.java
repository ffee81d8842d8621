package org.Aayush.allocator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Immutable worker (supply location) for capacitated assignment.
 */
@Value
@Builder(toBuilder = true)
public class Worker implements Located {
    /** Caller-facing worker id. */
    String id;
    /** Longitude in degrees (or planar x). */
    double longitude;
    /** Latitude in degrees (or planar y). */
    double latitude;
    /** Maximum number of points this worker accepts; null means unbounded. */
    Integer capacity;
    /** Extra input columns preserved verbatim. */
    @Singular
    Map<String, String> attributes;

    public static Worker of(String id, double longitude, double latitude) {
        return Worker.builder().id(id).longitude(longitude).latitude(latitude).build();
    }

    public static Worker of(String id, double longitude, double latitude, int capacity) {
        return Worker.builder().id(id).longitude(longitude).latitude(latitude).capacity(capacity).build();
    }

    /**
     * @return true when no capacity bound is configured.
     */
    public boolean isUnbounded() {
        return capacity == null;
    }
}
