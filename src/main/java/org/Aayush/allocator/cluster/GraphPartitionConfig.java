package org.Aayush.allocator.cluster;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings for the graph-partition clustering path.
 */
@Value
@Builder(toBuilder = true)
public class GraphPartitionConfig {
    /** Neighbors linked per vertex in the proximity graph. */
    @Builder.Default
    int nClosest = 15;

    /** Allowed partition imbalance as a fraction, 0.03 means 3%. */
    @Builder.Default
    double imbalance = 0.03d;

    /** Ask the partitioner to balance edges instead of vertices. */
    @Builder.Default
    boolean balanceEdges = false;

    /** Partitioner executable name or path. */
    @Builder.Default
    String executable = "kaffpa";

    /** Partitioner preconfiguration: fast, eco or strong. */
    @Builder.Default
    String preconfiguration = "strong";

    /** Wall-clock limit for one partitioner run. */
    @Builder.Default
    Duration timeout = Duration.ofMinutes(2L);

    /** Parent directory for scratch files; null uses the system temp directory. */
    Path workDirectory;

    public static GraphPartitionConfig defaults() {
        return GraphPartitionConfig.builder().build();
    }
}
