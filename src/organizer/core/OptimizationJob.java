package organizer.core;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle of a run submitted to {@link OptimizationRunner}.
 */
public class OptimizationJob {
    private final Future<OptimizationReport> future;
    private final AtomicBoolean cancelled;

    OptimizationJob(Future<OptimizationReport> future, AtomicBoolean cancelled) {
        this.future = future;
        this.cancelled = cancelled;
    }

    /** Asks the run to stop before its next neighbor proposal. */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelRequested() {
        return cancelled.get();
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * @throws CancellationException if the run was cancelled
     * @throws ExecutionException    wrapping any other failure of the run
     */
    public OptimizationReport get() throws InterruptedException, ExecutionException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw unwrapCancellation(e);
        }
    }

    public OptimizationReport get(long timeout, TimeUnit unit)
            throws InterruptedException, ExecutionException, TimeoutException {
        try {
            return future.get(timeout, unit);
        } catch (ExecutionException e) {
            throw unwrapCancellation(e);
        }
    }

    private static ExecutionException unwrapCancellation(ExecutionException e) {
        if (e.getCause() instanceof CancellationException) {
            throw (CancellationException) e.getCause();
        }
        return e;
    }
}
