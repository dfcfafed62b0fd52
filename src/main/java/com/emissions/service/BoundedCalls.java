package com.emissions.service;

import com.emissions.error.QueryCancelledException;
import com.emissions.error.QueryRejectedException;
import com.emissions.model.QueryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs blocking store and dataset calls on a worker pool and waits for them no longer
 * than the query's remaining time.
 *
 * <p>On timeout the context is cancelled so a worker still scanning stops at its next
 * checkpoint, and the caller gets a {@link QueryCancelledException}. A call the pool
 * refuses fails with {@link QueryRejectedException}. Failures inside the call are
 * rethrown unchanged.
 */
public class BoundedCalls {

    private static final Logger log = LoggerFactory.getLogger(BoundedCalls.class);

    private final Executor executor;

    public BoundedCalls(Executor executor) {
        this.executor = executor;
    }

    public <T> T call(String operation, QueryContext context, Supplier<T> task) {
        context.throwIfDone(operation);
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected {}: {}", operation, e.getMessage());
            throw new QueryRejectedException("Too many concurrent queries, " + operation + " was rejected", e);
        }
        try {
            return future.get(context.remaining().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            context.cancel();
            future.cancel(true);
            log.warn("Deadline exceeded during {}", operation);
            throw new QueryCancelledException("Query deadline exceeded during " + operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.cancel();
            future.cancel(true);
            throw new QueryCancelledException("Interrupted during " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Unexpected failure during " + operation, cause);
        }
    }

    public void run(String operation, QueryContext context, Runnable task) {
        call(operation, context, () -> {
            task.run();
            return null;
        });
    }
}
