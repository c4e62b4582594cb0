package org.matrixbfs.traversal;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;
import lombok.experimental.UtilityClass;
import org.matrixbfs.graph.AdjacencyGraph;

import java.util.Objects;

/**
 * Single-source breadth-first search over an {@link AdjacencyGraph}.
 *
 * <p>Every call owns its frontier queue and reached set; the graph is only read, so calls may
 * run concurrently against the same graph instance.</p>
 */
@UtilityClass
public class BreadthFirstSearch {

    /**
     * Visits every vertex reachable from {@code start} in breadth-first order.
     *
     * <p>Neighbors of a dequeued vertex are enqueued in ascending vertex order, which makes the
     * output deterministic.</p>
     *
     * @param graph graph to search.
     * @param start start vertex, must belong to {@code graph}.
     * @return visitation order starting with {@code start}.
     * @throws IllegalArgumentException when {@code start} is not a vertex of {@code graph}.
     */
    public static BfsTraversal bfsFrom(AdjacencyGraph graph, int start) {
        Objects.requireNonNull(graph, "graph");
        if (!graph.hasVertex(start)) {
            throw new IllegalArgumentException(
                    "start vertex " + start + " is not in the graph (vertex count " + graph.vertexCount() + ")");
        }

        int vertexCount = graph.vertexCount();
        IntArrayFIFOQueue frontier = new IntArrayFIFOQueue();
        VisitedSet reached = new VisitedSet(vertexCount);
        IntArrayList order = new IntArrayList();

        frontier.enqueue(start);
        reached.markVisited(start);

        while (!frontier.isEmpty()) {
            int current = frontier.dequeueInt();
            order.add(current);
            if (reached.size() == vertexCount) {
                // Everything is already queued; the rest of the frontier only needs draining.
                continue;
            }

            // Sorted set iteration yields ascending ids.
            IntIterator neighbors = graph.neighbors(current).orElseThrow().iterator();
            while (neighbors.hasNext()) {
                int next = neighbors.nextInt();
                if (reached.markVisited(next)) {
                    frontier.enqueue(next);
                }
            }
        }

        return new BfsTraversal(order);
    }
}
