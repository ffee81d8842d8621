package org.Aayush.allocator.error;

import java.util.List;

/**
 * Assignment stage could not place one or more points under current worker capacities.
 *
 * <p>The subject id is the first unassignable point; {@link #unassignedPointIds()} lists
 * all of them in input order.</p>
 */
public final class CapacityExhaustedException extends AllocatorException {
    public static final String REASON_CAPACITY_EXHAUSTED = "ASSIGN_CAPACITY_EXHAUSTED";

    private final List<String> unassignedPointIds;

    public CapacityExhaustedException(List<String> unassignedPointIds) {
        super(
                ErrorKind.CAPACITY_EXHAUSTED,
                REASON_CAPACITY_EXHAUSTED,
                firstOf(unassignedPointIds),
                "no worker has remaining capacity for points " + unassignedPointIds
        );
        this.unassignedPointIds = List.copyOf(unassignedPointIds);
    }

    /**
     * @return ids of every point that could not be placed.
     */
    public List<String> unassignedPointIds() {
        return unassignedPointIds;
    }

    private static String firstOf(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("unassignedPointIds must be non-empty");
        }
        return ids.get(0);
    }
}
