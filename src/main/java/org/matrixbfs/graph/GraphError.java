package org.matrixbfs.graph;

/**
 * Failure value returned by graph queries.
 *
 * @param reasonCode deterministic reason code, see {@link GraphException}.
 * @param vertex offending vertex.
 * @param message descriptive message naming the vertex.
 */
public record GraphError(String reasonCode, int vertex, String message) {

    /**
     * Creates the failure reported for a vertex outside {@code [0, vertexCount)}.
     */
    static GraphError unknownVertex(int vertex, int vertexCount) {
        return new GraphError(
                GraphException.REASON_UNKNOWN_VERTEX,
                vertex,
                "vertex " + vertex + " is not in the graph (vertex count " + vertexCount + ")"
        );
    }
}
