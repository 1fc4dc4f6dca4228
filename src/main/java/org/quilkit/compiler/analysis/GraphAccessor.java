package org.quilkit.compiler.analysis;

/**
 * Read-only view of a directed graph over dense integer nodes {@code 0..nodeCount()-1},
 * for exporters and schedulers that should not depend on how the graph was built.
 */
public interface GraphAccessor {

    int nodeCount();

    /**
     * @param node A node index.
     * @return The targets of the node's outgoing edges in ascending order.
     * @throws IndexOutOfBoundsException if the node does not exist.
     */
    int[] successors(int node);

    /**
     * @param node A node index.
     * @return The sources of the node's incoming edges in ascending order.
     * @throws IndexOutOfBoundsException if the node does not exist.
     */
    int[] predecessors(int node);

    /**
     * @param node A node index.
     * @return A human-readable label for the node.
     */
    String nodeLabel(int node);
}
