package org.Aayush.allocator.assign;

import lombok.Builder;
import lombok.Value;

/**
 * One point placed on one worker.
 */
@Value
@Builder
public class Assignment {
    int pointIndex;
    String pointId;
    int workerIndex;
    String workerId;
    /** Matrix distance from the point to the chosen worker. */
    double distance;
    /** 1-based position of the chosen worker in the point's distance-sorted worker list. */
    int rank;
}
