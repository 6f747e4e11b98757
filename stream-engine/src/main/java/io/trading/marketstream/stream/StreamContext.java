package io.trading.marketstream.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation scope governing one or more subscriptions.
 *
 * <p>Cancelling a context cancels every context derived from it. The background context can
 * never be cancelled.
 */
public final class StreamContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamContext.class);
    private static final StreamContext BACKGROUND = new StreamContext(false);

    /**
     * Handle to a cancel callback; closing it removes the callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private final boolean cancellable;
    private final Set<Runnable> callbacks = new LinkedHashSet<>();
    private final CompletableFuture<Void> cancelled = new CompletableFuture<>();
    private boolean deadlineExceeded = false;

    private StreamContext(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Returns the root context, which is never cancelled.
     */
    public static StreamContext background() {
        return BACKGROUND;
    }

    /**
     * Returns a new cancellable context with no parent.
     */
    public static StreamContext cancellable() {
        return new StreamContext(true);
    }

    /**
     * Returns a child that is cancelled with this context or by its own {@link #cancel()}.
     */
    public StreamContext withCancel() {
        StreamContext child = new StreamContext(true);
        Registration link = onCancel(child::cancel);
        child.onCancel(link::close);
        return child;
    }

    /**
     * Returns a child that is also cancelled once the timeout elapses.
     */
    public StreamContext withTimeout(Duration timeout) {
        StreamContext child = withCancel();
        CompletableFuture.delayedExecutor(timeout.toNanos(), TimeUnit.NANOSECONDS)
            .execute(child::expire);
        return child;
    }

    private void expire() {
        synchronized (this) {
            if (cancelled.isDone()) {
                return;
            }
            deadlineExceeded = true;
        }
        LOGGER.debug("Context deadline exceeded");
        cancel();
    }

    /**
     * Cancels this context and its children. Has no effect on the background context or
     * a context that is already cancelled.
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (!cancellable || cancelled.isDone()) {
                return;
            }
            cancelled.complete(null);
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                LOGGER.warn("Cancel callback failed", e);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.isDone();
    }

    /**
     * Returns whether the context was cancelled by its timeout.
     */
    public synchronized boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }

    /**
     * Runs the callback when the context is cancelled, immediately if it already is.
     */
    public Registration onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancellable) {
                return () -> { };
            }
            if (!cancelled.isDone()) {
                callbacks.add(callback);
                return () -> {
                    synchronized (StreamContext.this) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> { };
    }

    /**
     * Returns a future completed when the context is cancelled.
     */
    public CompletableFuture<Void> cancelled() {
        return cancelled.copy();
    }
}
