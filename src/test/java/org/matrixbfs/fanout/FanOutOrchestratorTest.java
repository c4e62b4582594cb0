package org.matrixbfs.fanout;

import org.matrixbfs.graph.AdjacencyGraph;
import org.matrixbfs.testutil.GraphFixtureFactory;
import org.matrixbfs.traversal.BfsTraversal;
import org.matrixbfs.traversal.BreadthFirstSearch;
import org.matrixbfs.traversal.TraversalEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Fan-Out Orchestrator Tests")
class FanOutOrchestratorTest {

    private static FanOutOrchestrator orchestrator(String poolName) {
        return FanOutOrchestrator.builder()
                .config(FanOutConfig.builder().workerCount(2).poolName(poolName).build())
                .build();
    }

    private static Set<String> liveThreadsNamed(String poolName) {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(Thread::isAlive)
                .map(Thread::getName)
                .filter(name -> name.startsWith(poolName + "-worker-"))
                .collect(Collectors.toSet());
    }

    private static void awaitNoLiveThreads(String poolName) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!liveThreadsNamed(poolName).isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(Set.of(), liveThreadsNamed(poolName), "pool threads leaked");
    }

    @Nested
    @DisplayName("1. Contract")
    class ContractTests {

        @ParameterizedTest
        @ValueSource(ints = {0, -1, Integer.MIN_VALUE})
        @DisplayName("Worker count below 1 fails with INVALID_WORKER_COUNT")
        void testInvalidWorkerCount(int workerCount) {
            FanOutException ex = assertThrows(FanOutException.class,
                    () -> orchestrator("invalid").traverseFromAllVertices(GraphFixtureFactory.pathWithSelfLoop(), workerCount));
            assertEquals(FanOutException.REASON_INVALID_WORKER_COUNT, ex.reasonCode());
            assertTrue(ex.getMessage().contains(Integer.toString(workerCount)));
        }

        @Test
        @DisplayName("Worker count is validated even for the empty graph")
        void testInvalidWorkerCountEmptyGraph() {
            FanOutException ex = assertThrows(FanOutException.class,
                    () -> orchestrator("invalid-empty").traverseFromAllVertices(AdjacencyGraph.empty(), 0));
            assertEquals(FanOutException.REASON_INVALID_WORKER_COUNT, ex.reasonCode());
        }

        @Test
        @DisplayName("Null graph is rejected")
        void testNullGraph() {
            assertThrows(NullPointerException.class, () -> orchestrator("null").traverseFromAllVertices(null, 2));
        }

        @Test
        @DisplayName("Empty graph yields no results and starts no pool")
        void testEmptyGraph() throws InterruptedException {
            AllVerticesResult result = orchestrator("empty-graph").traverseFromAllVertices(AdjacencyGraph.empty(), 3);
            assertTrue(result.getResults().isEmpty());
            assertEquals(Duration.ZERO, result.getTotalElapsed());
            assertEquals(3, result.getWorkerCount());
            assertEquals(0, result.workersUsed());
            assertEquals(Set.of(), liveThreadsNamed("empty-graph"));
        }

        @Test
        @DisplayName("Configured worker count is used by the single-argument overload")
        void testConfiguredWorkerCount() {
            AllVerticesResult result = orchestrator("configured").traverseFromAllVertices(GraphFixtureFactory.complete(4));
            assertEquals(2, result.getWorkerCount());
            assertEquals(4, result.getResults().size());
        }
    }

    @Nested
    @DisplayName("2. Results")
    class ResultTests {

        @Test
        @DisplayName("One result per vertex, ascending, matching sequential BFS")
        void testResultsMatchSequential() {
            AdjacencyGraph graph = GraphFixtureFactory.randomDirected(30, 0.08d, 17L);
            AllVerticesResult result = orchestrator("sequential-parity").traverseFromAllVertices(graph, 4);

            assertEquals(graph.vertexCount(), result.getResults().size());
            for (int v = 0; v < graph.vertexCount(); v++) {
                SingleVertexResult vertexResult = result.resultFor(v);
                assertEquals(v, vertexResult.getStartVertex());
                assertEquals(BreadthFirstSearch.bfsFrom(graph, v), vertexResult.getTraversal());
                GraphFixtureFactory.assertBreadthFirst(graph, v, vertexResult.getTraversal());
                assertFalse(vertexResult.getElapsed().isNegative());
                assertTrue(vertexResult.getWorkerId() >= 0 && vertexResult.getWorkerId() < 4);
            }
            assertTrue(result.workersUsed() >= 1 && result.workersUsed() <= 4);
        }

        @Test
        @DisplayName("Isolated vertices: each traversal is the start vertex alone")
        void testIsolatedPair() {
            AllVerticesResult result = orchestrator("isolated").traverseFromAllVertices(GraphFixtureFactory.isolatedPair(), 2);
            assertEquals(BfsTraversal.of(0), result.resultFor(0).getTraversal());
            assertEquals(BfsTraversal.of(1), result.resultFor(1).getTraversal());
        }

        @Test
        @DisplayName("Pool larger than the task count is valid")
        void testOversizedPool() {
            AllVerticesResult result = orchestrator("oversized").traverseFromAllVertices(GraphFixtureFactory.pathWithSelfLoop(), 16);
            assertEquals(16, result.getWorkerCount());
            assertEquals(3, result.getResults().size());
            assertTrue(result.workersUsed() <= 3);
        }

        @Test
        @DisplayName("Single worker runs every task on worker 0")
        void testSingleWorker() {
            AllVerticesResult result = orchestrator("single").traverseFromAllVertices(GraphFixtureFactory.complete(6), 1);
            assertEquals(1, result.workersUsed());
            for (SingleVertexResult vertexResult : result.getResults()) {
                assertEquals(0, vertexResult.getWorkerId());
            }
        }

        @Test
        @DisplayName("Repeated runs produce identical traversals")
        void testDeterminism() {
            AdjacencyGraph graph = GraphFixtureFactory.randomDirected(40, 0.05d, 3L);
            FanOutOrchestrator orchestrator = orchestrator("determinism");
            List<BfsTraversal> baseline = orchestrator.traverseFromAllVertices(graph, 3).getResults().stream()
                    .map(SingleVertexResult::getTraversal)
                    .collect(Collectors.toList());
            for (int run = 0; run < 5; run++) {
                List<BfsTraversal> current = orchestrator.traverseFromAllVertices(graph, 3).getResults().stream()
                        .map(SingleVertexResult::getTraversal)
                        .collect(Collectors.toList());
                assertEquals(baseline, current);
            }
        }

        @Test
        @DisplayName("Results are immutable")
        void testResultsImmutable() {
            AllVerticesResult result = orchestrator("immutable").traverseFromAllVertices(GraphFixtureFactory.complete(2), 1);
            assertThrows(UnsupportedOperationException.class, () -> result.getResults().clear());
        }
    }

    @Nested
    @DisplayName("3. Concurrency and resources")
    class ConcurrencyTests {

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("At most workerCount tasks run at the same time")
        void testBoundedParallelism() {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            TraversalEngine slowEngine = (graph, start) -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(5);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                running.decrementAndGet();
                return BreadthFirstSearch.bfsFrom(graph, start);
            };

            FanOutOrchestrator orchestrator = FanOutOrchestrator.builder()
                    .config(FanOutConfig.builder().workerCount(3).poolName("bounded").build())
                    .engine(slowEngine)
                    .build();
            AllVerticesResult result = orchestrator.traverseFromAllVertices(GraphFixtureFactory.complete(24), 3);

            assertEquals(24, result.getResults().size());
            assertTrue(peak.get() <= 3, "observed " + peak.get() + " concurrent tasks with 3 workers");
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("Results stay ordered by vertex when completion order differs")
        void testOrderingIndependentOfCompletion() {
            CountDownLatch lastVertexDone = new CountDownLatch(1);
            TraversalEngine reversedEngine = (graph, start) -> {
                if (start == 0) {
                    try {
                        lastVertexDone.await();
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                }
                BfsTraversal traversal = BreadthFirstSearch.bfsFrom(graph, start);
                if (start == graph.vertexCount() - 1) {
                    lastVertexDone.countDown();
                }
                return traversal;
            };

            FanOutOrchestrator orchestrator = FanOutOrchestrator.builder()
                    .config(FanOutConfig.builder().workerCount(2).poolName("reordered").build())
                    .engine(reversedEngine)
                    .build();
            AllVerticesResult result = orchestrator.traverseFromAllVertices(GraphFixtureFactory.directedCycle(6), 2);

            for (int v = 0; v < 6; v++) {
                assertEquals(v, result.resultFor(v).getStartVertex());
            }
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("A failing task fails the whole fan-out with TASK_FAILURE")
        void testTaskFailure() throws InterruptedException {
            IllegalStateException failure = new IllegalStateException("corrupt frontier");
            TraversalEngine failingEngine = (graph, start) -> {
                if (start == 2) {
                    throw failure;
                }
                return BreadthFirstSearch.bfsFrom(graph, start);
            };

            FanOutOrchestrator orchestrator = FanOutOrchestrator.builder()
                    .config(FanOutConfig.builder().workerCount(2).poolName("failing").build())
                    .engine(failingEngine)
                    .build();
            FanOutException ex = assertThrows(FanOutException.class,
                    () -> orchestrator.traverseFromAllVertices(GraphFixtureFactory.complete(5), 2));

            assertEquals(FanOutException.REASON_TASK_FAILURE, ex.reasonCode());
            assertSame(failure, ex.getCause());
            assertTrue(ex.getMessage().contains("vertex 2"));
            awaitNoLiveThreads("failing");
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("Interrupting the caller fails with INTERRUPTED after the workers stop")
        void testCallerInterrupted() throws InterruptedException {
            CountDownLatch started = new CountDownLatch(1);
            AtomicInteger running = new AtomicInteger();
            TraversalEngine busyEngine = (graph, start) -> {
                running.incrementAndGet();
                try {
                    started.countDown();
                    // Ignores interrupts, like a CPU-bound search.
                    long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(500);
                    while (System.nanoTime() < until) {
                        Thread.onSpinWait();
                    }
                    return BreadthFirstSearch.bfsFrom(graph, start);
                } finally {
                    running.decrementAndGet();
                }
            };
            FanOutOrchestrator orchestrator = FanOutOrchestrator.builder()
                    .config(FanOutConfig.builder().workerCount(2).poolName("interrupted").build())
                    .engine(busyEngine)
                    .build();

            Thread caller = Thread.currentThread();
            Thread interrupter = new Thread(() -> {
                try {
                    started.await();
                    Thread.sleep(50);
                } catch (InterruptedException ex) {
                    return;
                }
                caller.interrupt();
            }, "interrupter");
            interrupter.start();

            FanOutException ex;
            try {
                ex = assertThrows(FanOutException.class,
                        () -> orchestrator.traverseFromAllVertices(GraphFixtureFactory.complete(4), 2));
                assertEquals(0, running.get(), "traversals still running after return");
            } finally {
                assertTrue(Thread.interrupted(), "interrupt flag should be restored");
            }
            interrupter.join();

            assertEquals(FanOutException.REASON_INTERRUPTED, ex.reasonCode());
            assertInstanceOf(InterruptedException.class, ex.getCause());
            awaitNoLiveThreads("interrupted");
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("Pool threads are released after every run")
        void testNoThreadLeak() throws InterruptedException {
            FanOutOrchestrator orchestrator = orchestrator("leak-check");
            for (int run = 0; run < 10; run++) {
                orchestrator.traverseFromAllVertices(GraphFixtureFactory.complete(8), 4);
            }
            awaitNoLiveThreads("leak-check");
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("Worker ids come from the pool, not the caller")
        void testWorkerIdsFromPool() {
            Set<Integer> seen = ConcurrentHashMap.newKeySet();
            TraversalEngine recordingEngine = (graph, start) -> {
                seen.add(WorkerThread.currentWorkerId());
                return BreadthFirstSearch.bfsFrom(graph, start);
            };
            FanOutOrchestrator orchestrator = FanOutOrchestrator.builder()
                    .config(FanOutConfig.builder().workerCount(3).poolName("ids").build())
                    .engine(recordingEngine)
                    .build();
            AllVerticesResult result = orchestrator.traverseFromAllVertices(GraphFixtureFactory.complete(12), 3);

            assertFalse(seen.contains(WorkerThread.NO_WORKER));
            Set<Integer> reported = result.getResults().stream()
                    .map(SingleVertexResult::getWorkerId)
                    .collect(Collectors.toSet());
            assertEquals(seen, reported);
            assertEquals(reported.size(), result.workersUsed());
        }
    }
}
