package com.emissions.model;

import com.emissions.error.QueryCancelledException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deadline and cancellation signal for one query. Shared between the request thread and
 * the worker threads that perform store and dataset calls on its behalf.
 */
public final class QueryContext {

    private static final long UNBOUNDED = Long.MAX_VALUE;

    private final long deadlineNanos;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private QueryContext(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static QueryContext withTimeout(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        return new QueryContext(System.nanoTime() + timeout.toNanos());
    }

    public static QueryContext unbounded() {
        return new QueryContext(UNBOUNDED);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExpired() {
        return deadlineNanos != UNBOUNDED && System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * True once the query should stop doing work.
     */
    public boolean isDone() {
        return isCancelled() || isExpired();
    }

    /**
     * Time left before the deadline, zero once it has passed. {@link Long#MAX_VALUE}
     * nanoseconds for an unbounded context.
     */
    public Duration remaining() {
        if (deadlineNanos == UNBOUNDED) return Duration.ofNanos(Long.MAX_VALUE);
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    /**
     * @throws QueryCancelledException if the query was cancelled or its deadline passed
     */
    public void throwIfDone(String stage) {
        if (isCancelled()) throw new QueryCancelledException("Query cancelled during " + stage);
        if (isExpired()) throw new QueryCancelledException("Query deadline exceeded during " + stage);
    }
}
