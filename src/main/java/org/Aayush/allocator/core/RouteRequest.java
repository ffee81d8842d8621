package org.Aayush.allocator.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.allocator.distance.DistanceConfig;
import org.Aayush.allocator.distance.DistanceMetric;
import org.Aayush.allocator.model.Point;
import org.Aayush.allocator.route.RouteOptions;

import java.util.List;

/**
 * Route request in caller id space.
 */
@Value
@Builder(toBuilder = true)
public class RouteRequest {
    @Singular
    List<Point> points;
    /** Id of the fixed first point; overrides {@code options.startIndex} when set. */
    String startPointId;
    @Builder.Default
    DistanceMetric metric = DistanceMetric.PLANAR;
    @Builder.Default
    RouteOptions options = RouteOptions.defaults();
    @Builder.Default
    DistanceConfig distanceConfig = DistanceConfig.defaults();
}
