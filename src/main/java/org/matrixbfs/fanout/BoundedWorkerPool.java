package org.matrixbfs.fanout;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size worker pool scoped to one fan-out.
 * <p>
 * At most {@link #size()} submitted tasks run at the same time; the rest wait in the pool queue.
 * Workers are {@link WorkerThread}s numbered {@code 0..size-1} in creation order.
 * </p>
 * <p>
 * Use in try-with-resources: {@link #close()} stops accepting tasks and waits until every worker
 * has terminated.
 * </p>
 */
public final class BoundedWorkerPool implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(BoundedWorkerPool.class);

    @Getter
    @Accessors(fluent = true)
    private final int size;
    @Getter
    @Accessors(fluent = true)
    private final String name;
    private final ExecutorService executor;
    private final AtomicInteger createdWorkers = new AtomicInteger();

    /**
     * @param size number of workers, positive.
     * @param name prefix of worker thread names.
     */
    public BoundedWorkerPool(int size, String name) {
        if (size < 1) {
            throw new IllegalArgumentException("pool size must be positive: " + size);
        }
        this.size = size;
        this.name = Objects.requireNonNull(name, "name");
        ThreadFactory factory = task -> {
            WorkerThread worker = new WorkerThread(task, name, createdWorkers.getAndIncrement());
            worker.setDaemon(true);
            return worker;
        };
        this.executor = Executors.newFixedThreadPool(size, factory);
    }

    /**
     * Queues a task for execution on the next free worker.
     */
    public <T> Future<T> submit(Callable<T> task) {
        return executor.submit(Objects.requireNonNull(task, "task"));
    }

    /**
     * Number of worker threads started so far; never exceeds {@link #size()}.
     */
    public int startedWorkers() {
        return createdWorkers.get();
    }

    public boolean isTerminated() {
        return executor.isTerminated();
    }

    /**
     * Shuts the pool down and waits for every worker to exit.
     *
     * <p>Returns only once all workers have terminated, even if the caller is interrupted. An
     * interrupt while waiting interrupts running tasks, and the caller's interrupt flag is set
     * again before returning.</p>
     */
    @Override
    public void close() {
        executor.shutdown();
        boolean interrupted = false;
        while (true) {
            try {
                if (executor.awaitTermination(1, TimeUnit.SECONDS)) {
                    break;
                }
                LOGGER.debug("Waiting for pool '{}' to terminate", name);
            } catch (InterruptedException ex) {
                interrupted = true;
                executor.shutdownNow();
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Cancels queued tasks and interrupts running ones, without waiting.
     */
    void abort() {
        executor.shutdownNow();
    }
}
