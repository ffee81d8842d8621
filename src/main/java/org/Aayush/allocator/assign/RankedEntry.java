package org.Aayush.allocator.assign;

/**
 * One ranked candidate in a distance ranking.
 *
 * @param index candidate index in its input list.
 * @param id candidate id.
 * @param rank 1-based rank, nearest first.
 * @param distance matrix distance to the ranking subject.
 */
public record RankedEntry(int index, String id, int rank, double distance) {
}
