package solver.contracts;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Worker threads for batch simulation and bulk cache fills.
 *
 * <p>The worker count can change between batches; tasks already running keep
 * their thread until they finish.</p>
 */
public interface TaskPool extends AutoCloseable {

    /**
     * @throws IllegalStateException once the pool is closed
     */
    <T> Future<T> submit(Callable<T> task);

    /** Runs {@code task} without a result handle. */
    void execute(Runnable task);

    /** Resizes the pool for tasks submitted from now on. */
    void setParallelism(int threads);

    /** Current worker count, 0 once closed. */
    int getParallelism();

    /** Cancels queued tasks and refuses new ones. */
    void shutdownNow();

    @Override
    default void close() {
        shutdownNow();
    }
}
