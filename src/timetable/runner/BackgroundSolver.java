package timetable.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetable.config.SchedulingConfig;
import timetable.core.TimetableEngine;
import timetable.model.SolveResult;
import timetable.model.TimetableException;
import timetable.model.TimetableRequest;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs engine solves off the caller's thread. Each request ends in exactly one listener call:
 * the result, or one {@link TimetableException} (CANCELLED, TIMEOUT, NO_COURSES, ...).
 * <p>
 * The solver's own time limit is soft, so a watchdog waits {@code time_limit + grace} seconds and
 * then gives up on the worker.
 */
public class BackgroundSolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackgroundSolver.class);

    private final TimetableEngine engine;
    private final long graceMillis;
    private final ExecutorService supervisors;
    private final ExecutorService workers;

    public BackgroundSolver(TimetableEngine engine) {
        this(engine, TimeUnit.SECONDS.toMillis(SchedulingConfig.WATCHDOG_GRACE_SECONDS));
    }

    public BackgroundSolver(TimetableEngine engine, long graceMillis) {
        this(engine, graceMillis,
                Executors.newCachedThreadPool(daemonThreads("timetable-watchdog")),
                Executors.newCachedThreadPool(daemonThreads("timetable-solver")));
    }

    BackgroundSolver(TimetableEngine engine, long graceMillis, ExecutorService supervisors, ExecutorService workers) {
        this.engine = engine;
        this.graceMillis = graceMillis;
        this.supervisors = supervisors;
        this.workers = workers;
    }

    public SolveHandle submit(TimetableRequest request, boolean improve, SolveListener listener) {
        SolveHandle handle = new SolveHandle();
        supervisors.execute(() -> supervise(request, improve, listener, handle));
        return handle;
    }

    private void supervise(TimetableRequest request, boolean improve, SolveListener listener, SolveHandle handle) {
        AtomicBoolean delivered = new AtomicBoolean(false);
        try {
            if (handle.isCancelRequested()) {
                fail(listener, delivered, new TimetableException(TimetableException.Reason.CANCELLED,
                        "Cancelled before start"));
                return;
            }
            Future<SolveResult> future = workers.submit(() -> engine.generate(request, improve));
            long budget = TimeUnit.SECONDS.toMillis(request.getTimeLimitSeconds()) + graceMillis;
            try {
                SolveResult result = future.get(budget, TimeUnit.MILLISECONDS);
                if (delivered.compareAndSet(false, true))
                    listener.onFinished(result);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.error("Solve timed out after {} ms", budget);
                fail(listener, delivered, new TimetableException(TimetableException.Reason.TIMEOUT,
                        "Solver timed out after " + budget + " ms", e));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof TimetableException) {
                    fail(listener, delivered, (TimetableException) cause);
                } else {
                    log.error("Solve failed", cause);
                    fail(listener, delivered, new TimetableException(TimetableException.Reason.FAILED,
                            String.valueOf(cause), cause));
                }
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                fail(listener, delivered, new TimetableException(TimetableException.Reason.CANCELLED,
                        "Interrupted while waiting for the solver", e));
            }
        } finally {
            handle.markDone();
        }
    }

    private static void fail(SolveListener listener, AtomicBoolean delivered, TimetableException error) {
        if (delivered.compareAndSet(false, true))
            listener.onError(error);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        supervisors.shutdownNow();
        workers.shutdownNow();
    }
}
