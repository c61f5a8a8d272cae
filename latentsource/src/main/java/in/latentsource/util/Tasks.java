package in.latentsource.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Helpers for waiting on executor tasks.
 */
public final class Tasks {

    /**
     * Wait for every future in order and collect the results.
     *
     * A task's unchecked exception is rethrown as-is so typed pipeline failures
     * reach the caller unchanged. On the first failure the remaining futures
     * are cancelled.
     *
     * @throws IllegalStateException if interrupted or a task threw a checked exception
     */
    public static <T> List<T> awaitAll(List<? extends Future<T>> futures) {
        List<T> results = new ArrayList<>(futures.size());
        try {
            for (Future<T> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for pipeline tasks", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Pipeline task failed", cause);
        }
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private Tasks() {}
}
