package solver.impl;

import solver.contracts.TaskPool;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TaskPool} over a {@link ForkJoinPool} of daemon threads named
 * {@code Solver-Worker-<pool>-<n>}.
 *
 * <p>Simulated games and cache rows are independent, so the pool runs in async
 * (FIFO) mode. Resizing swaps in a fresh pool and lets the old one drain.</p>
 * <pre>
 * try (TaskPool pool = new TaskPoolImpl(8)) {
 *     Future&lt;Integer&gt; rounds = pool.submit(() -&gt; simulator.simulate("crane"));
 * }
 * </pre>
 */
public final class TaskPoolImpl implements TaskPool {

    private static final AtomicInteger POOL_IDS = new AtomicInteger();

    private final Object resizeLock = new Object();

    /** null after shutdown */
    private volatile ForkJoinPool workers;

    public TaskPoolImpl(int parallelism) {
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be >= 1");
        this.workers = createWorkers(parallelism);
    }

    @Override
    public <T> Future<T> submit(Callable<T> task) {
        Objects.requireNonNull(task, "task");
        return open().submit(task);
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        open().execute(task);
    }

    @Override
    public void setParallelism(int threads) {
        if (threads < 1) throw new IllegalArgumentException("parallelism must be >= 1");
        ForkJoinPool retired;
        synchronized (resizeLock) {
            retired = workers;
            if (retired == null || retired.getParallelism() == threads) return;
            workers = createWorkers(threads);
        }
        retired.shutdown();
    }

    @Override
    public int getParallelism() {
        ForkJoinPool w = workers;
        return w == null ? 0 : w.getParallelism();
    }

    @Override
    public void shutdownNow() {
        ForkJoinPool retired;
        synchronized (resizeLock) {
            retired = workers;
            workers = null;
        }
        if (retired != null) retired.shutdownNow();
    }

    private ForkJoinPool open() {
        ForkJoinPool w = workers;
        if (w == null) throw new IllegalStateException("Task pool is closed");
        return w;
    }

    private static ForkJoinPool createWorkers(int parallelism) {
        int poolId = POOL_IDS.incrementAndGet();
        AtomicInteger next = new AtomicInteger();
        return new ForkJoinPool(parallelism, fjp -> {
            ForkJoinWorkerThread t = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(fjp);
            t.setName("Solver-Worker-" + poolId + "-" + next.getAndIncrement());
            t.setDaemon(true);
            return t;
        }, null, true);
    }
}
