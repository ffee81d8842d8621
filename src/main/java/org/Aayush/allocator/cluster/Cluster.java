package org.Aayush.allocator.cluster;

import lombok.Builder;
import lombok.Value;
import org.Aayush.allocator.model.Coordinate;

/**
 * One cluster: id, member point indices in ascending order, and an optional centroid.
 */
@Value
@Builder
public class Cluster {
    /** Cluster id in {@code [0, k)}. */
    int id;
    /** Member indices into the input point list, ascending. */
    int[] memberIndices;
    /** Coordinate mean of the members; null when unknown or the cluster is empty. */
    Coordinate centroid;

    /**
     * Returns a defensive copy of member indices.
     */
    public int[] getMemberIndices() {
        return memberIndices.clone();
    }

    public int size() {
        return memberIndices.length;
    }
}
