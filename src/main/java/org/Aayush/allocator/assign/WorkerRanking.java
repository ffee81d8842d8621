package org.Aayush.allocator.assign;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Every worker ranked by distance from one point; ties keep worker input order.
 */
@Value
@Builder
public class WorkerRanking {
    int pointIndex;
    String pointId;
    @Singular
    List<RankedEntry> workers;
}
