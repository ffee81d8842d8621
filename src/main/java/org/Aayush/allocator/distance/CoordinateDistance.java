package org.Aayush.allocator.distance;

import lombok.experimental.UtilityClass;
import org.Aayush.allocator.model.Coordinate;

/**
 * Closed-form distances between two coordinates, one per built-in metric.
 */
@UtilityClass
public class CoordinateDistance {
    /** IUGG mean earth radius. */
    public static final double EARTH_RADIUS_METERS = 6_371_008.8d;

    /**
     * Straight-line distance treating longitude as x and latitude as y, in degrees.
     */
    public static double planar(Coordinate from, Coordinate to) {
        return Math.hypot(to.longitude() - from.longitude(), to.latitude() - from.latitude());
    }

    /**
     * Haversine great-circle distance in meters on a spherical earth.
     *
     * <p>Deltas enter as absolute values so swapping the arguments gives the identical
     * result. Longitude deltas past the antimeridian wrap through the half-angle sine.</p>
     */
    public static double haversineMeters(Coordinate from, Coordinate to) {
        double phiFrom = Math.toRadians(from.latitude());
        double phiTo = Math.toRadians(to.latitude());
        double halfDeltaPhi = Math.toRadians(Math.abs(to.latitude() - from.latitude())) / 2.0d;
        double halfDeltaLambda = Math.toRadians(Math.abs(to.longitude() - from.longitude())) / 2.0d;

        double h = square(Math.sin(halfDeltaPhi))
                + Math.cos(phiFrom) * Math.cos(phiTo) * square(Math.sin(halfDeltaLambda));
        h = Math.min(1.0d, Math.max(0.0d, h));
        return 2.0d * EARTH_RADIUS_METERS * Math.atan2(Math.sqrt(h), Math.sqrt(1.0d - h));
    }

    private static double square(double value) {
        return value * value;
    }
}
