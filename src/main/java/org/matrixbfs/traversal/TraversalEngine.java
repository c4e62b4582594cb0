package org.matrixbfs.traversal;

import org.matrixbfs.graph.AdjacencyGraph;

/**
 * Single-source traversal contract used by the fan-out.
 *
 * <p>Implementations must not keep state between calls: one instance is invoked concurrently
 * from every pool worker.</p>
 */
@FunctionalInterface
public interface TraversalEngine {
    /**
     * Traverses {@code graph} from {@code start}.
     *
     * @param graph read-only graph.
     * @param start valid vertex of {@code graph}.
     * @return visitation order starting with {@code start}.
     */
    BfsTraversal traverse(AdjacencyGraph graph, int start);

    /**
     * Returns the breadth-first engine.
     */
    static TraversalEngine breadthFirst() {
        return BreadthFirstSearch::bfsFrom;
    }
}
