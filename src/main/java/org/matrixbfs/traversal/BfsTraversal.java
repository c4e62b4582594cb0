package org.matrixbfs.traversal;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Objects;

/**
 * Visitation order of one breadth-first search.
 *
 * <p>The first vertex is the start vertex; no vertex appears twice.</p>
 *
 * @param vertices unmodifiable visitation order.
 */
public record BfsTraversal(IntList vertices) {

    /**
     * Copies the order and rejects empty sequences.
     */
    public BfsTraversal {
        Objects.requireNonNull(vertices, "vertices");
        if (vertices.isEmpty()) {
            throw new IllegalArgumentException("a traversal always contains its start vertex");
        }
        vertices = IntLists.unmodifiable(new IntArrayList(vertices));
    }

    /**
     * Creates a traversal from an explicit visitation order.
     */
    public static BfsTraversal of(int... vertices) {
        return new BfsTraversal(IntArrayList.wrap(vertices));
    }

    public int start() {
        return vertices.getInt(0);
    }

    public int size() {
        return vertices.size();
    }

    public boolean contains(int vertex) {
        return vertices.contains(vertex);
    }

    @Override
    public String toString() {
        return vertices.toString();
    }
}
