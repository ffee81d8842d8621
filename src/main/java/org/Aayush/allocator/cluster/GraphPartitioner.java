package org.Aayush.allocator.cluster;

/**
 * External balanced graph partitioner contract.
 */
public interface GraphPartitioner {
    /**
     * Backend name for result metadata.
     */
    String name();

    /**
     * Splits the graph into {@code k} blocks.
     *
     * @return one block id per vertex; validated by the caller.
     * @throws org.Aayush.allocator.error.SolverException when the backend fails.
     */
    int[] partition(ProximityGraph graph, int k, long seed, GraphPartitionConfig config);
}
