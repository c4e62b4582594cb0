package org.matrixbfs.fanout;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Builder;
import org.matrixbfs.core.time.Stopwatch;
import org.matrixbfs.core.time.TimedComputation;
import org.matrixbfs.graph.AdjacencyGraph;
import org.matrixbfs.traversal.BfsTraversal;
import org.matrixbfs.traversal.TraversalEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Runs one traversal per vertex of a graph on a bounded worker pool.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate the worker count (independent of the vertex count; larger pools than tasks are fine).</li>
 * <li>Open a {@link BoundedWorkerPool} of exactly {@code workerCount} workers.</li>
 * <li>Submit one timed traversal per vertex in ascending vertex order.</li>
 * <li>Join every task in submission order, so results are ordered by vertex regardless of completion order.</li>
 * <li>Close the pool before returning, on success and on failure.</li>
 * </ul>
 *
 * <p>A failing task fails the whole fan-out with {@link FanOutException#REASON_TASK_FAILURE}.
 * There is no timeout: a task that never finishes blocks the caller.</p>
 */
public final class FanOutOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(FanOutOrchestrator.class);

    private final FanOutConfig config;
    private final TraversalEngine engine;

    /**
     * Creates an orchestrator.
     *
     * @param config optional configuration, {@link FanOutConfig#defaults()} when null.
     * @param engine optional traversal engine, breadth-first when null.
     */
    @Builder
    public FanOutOrchestrator(FanOutConfig config, TraversalEngine engine) {
        this.config = config == null ? FanOutConfig.defaults() : config;
        this.engine = engine == null ? TraversalEngine.breadthFirst() : engine;
    }

    /**
     * Creates a breadth-first orchestrator configured from system properties.
     */
    public FanOutOrchestrator() {
        this(null, null);
    }

    public FanOutConfig config() {
        return config;
    }

    /**
     * Traverses from every vertex using the configured worker count.
     *
     * @see #traverseFromAllVertices(AdjacencyGraph, int)
     */
    public AllVerticesResult traverseFromAllVertices(AdjacencyGraph graph) {
        return traverseFromAllVertices(graph, config.getWorkerCount());
    }

    /**
     * Traverses from every vertex of {@code graph} with at most {@code workerCount} concurrent tasks.
     *
     * @param graph graph shared read-only by all tasks.
     * @param workerCount pool size, at least 1.
     * @return one result per vertex, in ascending vertex order, plus total timing.
     * @throws FanOutException {@link FanOutException#REASON_INVALID_WORKER_COUNT} when
     *                         {@code workerCount < 1}, {@link FanOutException#REASON_TASK_FAILURE}
     *                         when a traversal fails, {@link FanOutException#REASON_INTERRUPTED}
     *                         when the caller is interrupted while waiting.
     */
    public AllVerticesResult traverseFromAllVertices(AdjacencyGraph graph, int workerCount) {
        Objects.requireNonNull(graph, "graph");
        if (workerCount < 1) {
            throw new FanOutException(
                    FanOutException.REASON_INVALID_WORKER_COUNT,
                    "worker count must be at least 1, got " + workerCount
            );
        }

        IntList vertices = graph.vertices();
        LOGGER.debug("Starting traversal from all vertices ({}) with {} workers", vertices.size(), workerCount);

        if (vertices.isEmpty()) {
            return AllVerticesResult.builder()
                    .totalElapsed(Duration.ZERO)
                    .workerCount(workerCount)
                    .build();
        }

        TimedComputation<List<SingleVertexResult>> run;
        try (BoundedWorkerPool pool = new BoundedWorkerPool(workerCount, config.getPoolName())) {
            run = Stopwatch.timed(() -> submitAndCollect(pool, graph, vertices));
        }

        AllVerticesResult result = AllVerticesResult.builder()
                .results(run.result())
                .totalElapsed(run.elapsed())
                .workerCount(workerCount)
                .build();
        LOGGER.debug("Workers used in current run: {} of {}", result.workersUsed(), workerCount);
        LOGGER.debug("Total time elapsed in current run: {} ms", Stopwatch.formatMillis(result.getTotalElapsed()));
        return result;
    }

    private List<SingleVertexResult> submitAndCollect(BoundedWorkerPool pool, AdjacencyGraph graph, IntList vertices) {
        List<Future<SingleVertexResult>> pending = new ArrayList<>(vertices.size());
        for (int i = 0; i < vertices.size(); i++) {
            int start = vertices.getInt(i);
            pending.add(pool.submit(() -> traverseFrom(graph, start)));
        }

        List<SingleVertexResult> results = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            int start = vertices.getInt(i);
            try {
                results.add(pending.get(i).get());
            } catch (ExecutionException ex) {
                pool.abort();
                LOGGER.warn("Traversal from vertex {} failed, aborting fan-out", start, ex.getCause());
                throw new FanOutException(
                        FanOutException.REASON_TASK_FAILURE,
                        "traversal from vertex " + start + " failed: " + ex.getCause(),
                        ex.getCause()
                );
            } catch (InterruptedException ex) {
                pool.abort();
                Thread.currentThread().interrupt();
                throw new FanOutException(
                        FanOutException.REASON_INTERRUPTED,
                        "interrupted while waiting for traversal from vertex " + start,
                        ex
                );
            }
        }
        return results;
    }

    private SingleVertexResult traverseFrom(AdjacencyGraph graph, int start) {
        int workerId = WorkerThread.currentWorkerId();
        LOGGER.debug("Start traversal from vertex {} on worker {}", start, workerId);
        TimedComputation<BfsTraversal> traversal = Stopwatch.timed(() -> engine.traverse(graph, start));
        LOGGER.debug("Finish traversal from vertex {}. Time elapsed: {} ms",
                start, Stopwatch.formatMillis(traversal.elapsed()));
        return SingleVertexResult.builder()
                .startVertex(start)
                .traversal(traversal.result())
                .elapsed(traversal.elapsed())
                .workerId(workerId)
                .build();
    }
}
