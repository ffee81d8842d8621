package org.Aayush.allocator.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.allocator.route.Route;

@Value
@Builder
public class RouteResponse {
    Route route;
    InvocationMetadata metadata;
}
