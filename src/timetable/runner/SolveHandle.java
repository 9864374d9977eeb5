package timetable.runner;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller side of a submitted solve.
 */
public class SolveHandle {
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    /**
     * Only honoured if the solve has not started yet; a running search is not interrupted.
     */
    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public boolean isDone() {
        return done.isDone();
    }

    /** Completes after the listener has been called. */
    public CompletableFuture<Void> completion() {
        return done;
    }

    void markDone() {
        done.complete(null);
    }
}
