package org.matrixbfs.io;

import org.matrixbfs.graph.AdjacencyGraph;

import java.util.Objects;
import java.util.Random;

/**
 * Generates random undirected graphs.
 *
 * <p>Each cell of the lower triangle, diagonal included, is an independent fair coin flip and is
 * mirrored into the upper triangle. The resulting matrix is symmetric and may contain self-loops.</p>
 */
public final class RandomGraphGenerator {

    private final Random random;

    /**
     * Creates an unseeded generator.
     */
    public RandomGraphGenerator() {
        this(new Random());
    }

    /**
     * Creates a reproducible generator.
     */
    public RandomGraphGenerator(long seed) {
        this(new Random(seed));
    }

    public RandomGraphGenerator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Generates a random symmetric graph.
     *
     * @param vertexCount number of vertices.
     * @throws GraphFormatException with {@link GraphFormatException#REASON_NEGATIVE_VERTEX_COUNT}
     *                              when {@code vertexCount < 0}.
     */
    public AdjacencyGraph withRandomEdges(int vertexCount) {
        if (vertexCount < 0) {
            throw new GraphFormatException(
                    GraphFormatException.REASON_NEGATIVE_VERTEX_COUNT,
                    "graph cannot have a negative number of vertices: " + vertexCount
            );
        }
        int[][] matrix = new int[vertexCount][vertexCount];
        for (int i = 0; i < vertexCount; i++) {
            for (int j = 0; j <= i; j++) {
                int edge = random.nextInt(2);
                matrix[i][j] = edge;
                matrix[j][i] = edge;
            }
        }
        return AdjacencyGraph.fromMatrix(matrix);
    }
}
