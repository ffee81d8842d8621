package org.Aayush.allocator.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.allocator.distance.DistanceConfig;
import org.Aayush.allocator.distance.DistanceMetric;
import org.Aayush.allocator.model.Point;
import org.Aayush.allocator.model.Worker;

import java.util.List;

/**
 * Assignment request in caller id space.
 */
@Value
@Builder(toBuilder = true)
public class AssignmentRequest {
    @Singular
    List<Point> points;
    @Singular
    List<Worker> workers;
    /** Optional per-worker capacity override; null entries mean unbounded. */
    List<Integer> capacities;
    @Builder.Default
    DistanceMetric metric = DistanceMetric.PLANAR;
    @Builder.Default
    DistanceConfig distanceConfig = DistanceConfig.defaults();
}
