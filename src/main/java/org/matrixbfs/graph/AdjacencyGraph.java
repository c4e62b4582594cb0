package org.matrixbfs.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Immutable graph backed by a dense 0/1 adjacency matrix.
 * <p>
 * {@code matrix[i][j] == 1} means there is an edge from vertex {@code i} to vertex {@code j}.
 * Vertices are the row indices {@code [0, vertexCount)}. Self-loops are allowed.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> instances are never mutated after construction and may be
 * read concurrently from any number of threads.
 * </p>
 */
public final class AdjacencyGraph {

    private static final AdjacencyGraph EMPTY = new AdjacencyGraph(new int[0][]);

    private final int[][] matrix;
    @Getter
    @Accessors(fluent = true)
    private final int vertexCount;
    @Getter
    @Accessors(fluent = true)
    private final long edgeCount;

    private AdjacencyGraph(int[][] matrix) {
        this.matrix = matrix;
        this.vertexCount = matrix.length;
        long edges = 0L;
        for (int[] row : matrix) {
            for (int cell : row) {
                edges += cell;
            }
        }
        this.edgeCount = edges;
    }

    /**
     * Validates and copies an adjacency matrix.
     *
     * @param matrix square matrix whose cells are 0 or 1.
     * @return graph over {@code matrix.length} vertices.
     * @throws GraphException with {@link GraphException#REASON_INVALID_MATRIX} when the matrix is
     *                        null, not square, or holds a value outside {@code {0, 1}}.
     */
    public static AdjacencyGraph fromMatrix(int[][] matrix) {
        if (matrix == null) {
            throw new GraphException(GraphException.REASON_INVALID_MATRIX, "adjacency matrix cannot be null");
        }
        int size = matrix.length;
        int[][] copy = new int[size][];
        for (int i = 0; i < size; i++) {
            int[] row = matrix[i];
            if (row == null || row.length != size) {
                throw new GraphException(
                        GraphException.REASON_INVALID_MATRIX,
                        "row " + i + " has length " + (row == null ? "null" : row.length)
                                + ", expected " + size + " for a square matrix"
                );
            }
            for (int j = 0; j < size; j++) {
                if (row[j] != 0 && row[j] != 1) {
                    throw new GraphException(
                            GraphException.REASON_INVALID_MATRIX,
                            "cell (" + i + ", " + j + ") holds " + row[j] + ", expected 0 or 1"
                    );
                }
            }
            copy[i] = row.clone();
        }
        return new AdjacencyGraph(copy);
    }

    /**
     * Returns the graph without vertices.
     */
    public static AdjacencyGraph empty() {
        return EMPTY;
    }

    /**
     * Returns all vertices in ascending order.
     */
    public IntList vertices() {
        IntArrayList vertices = new IntArrayList(vertexCount);
        for (int v = 0; v < vertexCount; v++) {
            vertices.add(v);
        }
        return IntLists.unmodifiable(vertices);
    }

    public boolean hasVertex(int vertex) {
        return 0 <= vertex && vertex < vertexCount;
    }

    /**
     * Tests for an edge {@code from -> to}.
     *
     * @return edge flag, or {@link GraphException#REASON_UNKNOWN_VERTEX} naming the first invalid vertex.
     */
    public GraphQuery<Boolean> hasEdge(int from, int to) {
        if (!hasVertex(from)) {
            return GraphQuery.failure(GraphError.unknownVertex(from, vertexCount));
        }
        if (!hasVertex(to)) {
            return GraphQuery.failure(GraphError.unknownVertex(to, vertexCount));
        }
        return GraphQuery.success(matrix[from][to] == 1);
    }

    /**
     * Returns the out-neighbors of a vertex in ascending order.
     *
     * <p>A vertex with a self-loop is its own neighbor.</p>
     *
     * @return unmodifiable sorted neighbor set, or {@link GraphException#REASON_UNKNOWN_VERTEX}.
     */
    public GraphQuery<IntSortedSet> neighbors(int vertex) {
        if (!hasVertex(vertex)) {
            return GraphQuery.failure(GraphError.unknownVertex(vertex, vertexCount));
        }
        int[] row = matrix[vertex];
        IntRBTreeSet neighbors = new IntRBTreeSet();
        for (int v = 0; v < vertexCount; v++) {
            if (row[v] == 1) {
                neighbors.add(v);
            }
        }
        return GraphQuery.success(IntSortedSets.unmodifiable(neighbors));
    }

    /**
     * Returns a copy of one matrix row.
     *
     * @throws GraphException when the vertex is unknown.
     */
    public int[] row(int vertex) {
        if (!hasVertex(vertex)) {
            throw new GraphException(GraphError.unknownVertex(vertex, vertexCount));
        }
        return matrix[vertex].clone();
    }

    /**
     * Returns a deep copy of the adjacency matrix.
     */
    public int[][] matrixCopy() {
        int[][] copy = new int[vertexCount][];
        for (int i = 0; i < vertexCount; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AdjacencyGraph)) {
            return false;
        }
        return Arrays.deepEquals(matrix, ((AdjacencyGraph) other).matrix);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(matrix);
    }

    @Override
    public String toString() {
        return "AdjacencyGraph[vertices=" + vertexCount + ", edges=" + edgeCount + "]";
    }
}
