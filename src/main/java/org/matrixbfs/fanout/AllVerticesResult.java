package org.matrixbfs.fanout;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one fan-out: a breadth-first search from every vertex of a graph.
 */
@Value
@Builder
public class AllVerticesResult {
    /** One result per vertex, ordered by start vertex ascending. */
    @Singular
    List<SingleVertexResult> results;
    /** Wall-clock duration of submission plus collection. */
    @NonNull
    Duration totalElapsed;
    /** Configured number of workers. */
    int workerCount;

    /**
     * Number of distinct workers that ran at least one search.
     */
    public int workersUsed() {
        return (int) results.stream().mapToInt(SingleVertexResult::getWorkerId).distinct().count();
    }

    /**
     * Returns the result for the search started at {@code vertex}.
     *
     * @throws IndexOutOfBoundsException when the graph had no such vertex.
     */
    public SingleVertexResult resultFor(int vertex) {
        return results.get(vertex);
    }
}
