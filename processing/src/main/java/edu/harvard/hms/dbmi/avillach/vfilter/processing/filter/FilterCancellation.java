package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterCancelledException;

import java.time.Duration;

/**
 * Lets a caller abort an evaluation, explicitly or through a deadline. Evaluation checks it at every store call, at every
 * conjunction and periodically while scanning variants; interrupting the evaluating thread has the same effect as cancelling.
 */
public class FilterCancellation {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final long deadlineNanos;

    private volatile boolean cancelled;

    private FilterCancellation(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static FilterCancellation none() {
        return new FilterCancellation(NO_DEADLINE);
    }

    public static FilterCancellation withTimeout(Duration timeout) {
        return new FilterCancellation(System.nanoTime() + timeout.toNanos());
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted() || (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos > 0);
    }

    /**
     * @param checkpoint where evaluation currently is, for the exception message
     */
    public void checkpoint(String checkpoint) {
        if (isCancelled()) {
            throw new FilterCancelledException(checkpoint);
        }
    }
}
