package org.Aayush.allocator.model;

/**
 * Bare (longitude, latitude) pair used for centroids and distance math.
 */
public record Coordinate(double longitude, double latitude) {

    public static Coordinate of(Located location) {
        return new Coordinate(location.getLongitude(), location.getLatitude());
    }
}
