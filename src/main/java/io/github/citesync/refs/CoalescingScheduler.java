package io.github.citesync.refs;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a task after the current unit of work, with at most one run pending at a time.
 * Requests made while a run is pending are folded into it. The pending flag is cleared right before
 * the task starts, so a request made by the task itself schedules a fresh run.
 */
public class CoalescingScheduler {
    private static final Logger logger = LogManager.getLogger(CoalescingScheduler.class);

    private final Executor executor;
    private final Runnable task;
    private final AtomicBoolean pending = new AtomicBoolean(false);

    public CoalescingScheduler(Executor executor, Runnable task) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.task = Objects.requireNonNull(task, "task");
    }

    /**
     * Requests a run.
     *
     * @return true if a new run was handed to the executor, false if one was already pending
     */
    public boolean schedule() {
        if (!pending.compareAndSet(false, true)) {
            logger.debug("Run already pending, request coalesced");
            return false;
        }
        try {
            executor.execute(this::runPending);
        } catch (RejectedExecutionException e) {
            pending.set(false);
            throw e;
        }
        return true;
    }

    public boolean isPending() {
        return pending.get();
    }

    /**
     * Drops the pending run, if any. The executor may still call back, but the task will not run.
     */
    public void cancel() {
        pending.set(false);
    }

    private void runPending() {
        if (!pending.compareAndSet(true, false)) {
            logger.debug("Pending run was cancelled");
            return;
        }
        task.run();
    }
}
