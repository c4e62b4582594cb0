package org.matrixbfs.fanout;

/**
 * Pool thread carrying the worker id assigned by {@link BoundedWorkerPool} when it was created.
 */
public final class WorkerThread extends Thread {
    /** Returned by {@link #currentWorkerId()} outside a pool. */
    public static final int NO_WORKER = -1;

    private final int workerId;

    WorkerThread(Runnable target, String poolName, int workerId) {
        super(target, poolName + "-worker-" + workerId);
        this.workerId = workerId;
    }

    public int workerId() {
        return workerId;
    }

    /**
     * Returns the worker id of the calling thread, or {@link #NO_WORKER} when the caller is not a
     * pool worker.
     */
    public static int currentWorkerId() {
        Thread current = Thread.currentThread();
        if (current instanceof WorkerThread) {
            return ((WorkerThread) current).workerId;
        }
        return NO_WORKER;
    }
}
