package org.Aayush.allocator.assign;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Every point ranked by distance to one worker; ties keep point input order.
 */
@Value
@Builder
public class PointRanking {
    int workerIndex;
    String workerId;
    @Singular
    List<RankedEntry> points;
}
