package org.matrixbfs.fanout;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.matrixbfs.traversal.BfsTraversal;

import java.time.Duration;

/**
 * Outcome of the breadth-first search started from one vertex.
 */
@Value
@Builder
public class SingleVertexResult {
    /** Vertex the search started from. */
    int startVertex;
    /** Visitation order. */
    @NonNull
    BfsTraversal traversal;
    /** Wall-clock duration of the search. */
    @NonNull
    Duration elapsed;
    /** Id of the pool worker that ran the search. */
    int workerId;
}
