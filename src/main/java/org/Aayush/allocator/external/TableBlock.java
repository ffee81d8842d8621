package org.Aayush.allocator.external;

/**
 * One sub-matrix returned by a table service call.
 *
 * <p>Row-major arrays sized {@code rows * cols}. Cells the service could not resolve are
 * {@link Double#NaN}; callers must reject them rather than substitute values.</p>
 *
 * @param rows number of sources in the chunk.
 * @param cols number of targets in the chunk.
 * @param distances distances in meters.
 * @param durations durations in seconds, or null when not requested.
 */
public record TableBlock(int rows, int cols, double[] distances, double[] durations) {
    public TableBlock {
        if (distances.length != rows * cols) {
            throw new IllegalArgumentException("distances length must equal rows * cols");
        }
        if (durations != null && durations.length != distances.length) {
            throw new IllegalArgumentException("durations length must equal distances length");
        }
    }
}
