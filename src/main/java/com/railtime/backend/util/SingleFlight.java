package com.railtime.backend.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Coalesces concurrent calls into one execution.
 * <p>
 * The slot holds at most one pending flight. The first caller (the leader) runs
 * the supplier on its own thread; callers arriving while the flight is pending
 * wait for it and receive the same value, or the same exception instance.
 * The slot is cleared once the flight completes, so the next call starts a new one.
 */
public class SingleFlight<T> {

    private static final class Flight<V> {
        final CompletableFuture<V> future = new CompletableFuture<>();
        final AtomicInteger callers = new AtomicInteger(1);
    }

    private final Object lock = new Object();
    private Flight<T> current;

    public T execute(Supplier<T> supplier) {
        Flight<T> flight;
        boolean leader;
        synchronized (lock) {
            if (current == null) {
                current = new Flight<>();
                flight = current;
                leader = true;
            } else {
                flight = current;
                flight.callers.incrementAndGet();
                leader = false;
            }
        }

        if (leader) {
            try {
                T value = supplier.get();
                flight.future.complete(value);
                return value;
            } catch (RuntimeException | Error e) {
                flight.future.completeExceptionally(e);
                throw e;
            } finally {
                synchronized (lock) {
                    if (current == flight) {
                        current = null;
                    }
                }
            }
        }

        return await(flight);
    }

    public boolean isInFlight() {
        synchronized (lock) {
            return current != null;
        }
    }

    /**
     * Number of callers attached to the pending flight, leader included; 0 when idle.
     */
    public int callers() {
        synchronized (lock) {
            return current == null ? 0 : current.callers.get();
        }
    }

    private T await(Flight<T> flight) {
        try {
            return flight.future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new CompletionException(cause);
        }
    }
}
