package org.matrixbfs.traversal;

import java.util.BitSet;

/**
 * Reached-vertex set for one breadth-first search.
 * <p>
 * Wraps a {@link java.util.BitSet}: one bit per vertex, O(1) mark and test.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. Each search owns its own instance.
 * </p>
 */
public final class VisitedSet {

    private final BitSet reached;
    private int size;

    /**
     * @param vertexCount number of vertices of the searched graph.
     */
    public VisitedSet(int vertexCount) {
        if (vertexCount < 0) {
            throw new IllegalArgumentException("vertexCount must be non-negative");
        }
        this.reached = new BitSet(vertexCount);
    }

    /**
     * Marks a vertex as reached.
     *
     * @return {@code true} if the vertex was not reached before.
     */
    public boolean markVisited(int vertex) {
        if (reached.get(vertex)) {
            return false;
        }
        reached.set(vertex);
        size++;
        return true;
    }

    /**
     * Number of reached vertices.
     */
    public int size() {
        return size;
    }
}
