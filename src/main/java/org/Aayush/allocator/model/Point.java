package org.Aayush.allocator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Immutable input point.
 *
 * <p>Attributes are opaque caller columns carried through every stage unchanged.</p>
 */
@Value
@Builder(toBuilder = true)
public class Point implements Located {
    /** Caller-facing point id. */
    String id;
    /** Longitude in degrees (or planar x). */
    double longitude;
    /** Latitude in degrees (or planar y). */
    double latitude;
    /** Extra input columns preserved verbatim, in input column order. */
    @Singular
    Map<String, String> attributes;

    /**
     * Convenience factory for attribute-free points.
     */
    public static Point of(String id, double longitude, double latitude) {
        return Point.builder().id(id).longitude(longitude).latitude(latitude).build();
    }
}
