package org.Aayush.allocator.model;

/**
 * Anything with an id and a (longitude, latitude) position.
 */
public interface Located {
    /**
     * @return stable caller-facing id.
     */
    String getId();

    /**
     * @return longitude (or planar x).
     */
    double getLongitude();

    /**
     * @return latitude (or planar y).
     */
    double getLatitude();
}
