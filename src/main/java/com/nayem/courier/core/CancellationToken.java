package com.nayem.courier.core;

import com.nayem.courier.exception.DispatchCancelledException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal passed through every dispatch, including cascaded ones.
 * <p>
 * Courier checks the token before each middleware phase and before the handler runs.
 * Handlers doing long work should check it themselves.
 * </p>
 */
public final class CancellationToken {

    /**
     * A token that can never be cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Signals cancellation. Registered callbacks run once, on the calling thread.
     *
     * @throws UnsupportedOperationException for {@link #NONE}
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        if (cancelled.compareAndSet(false, true)) {
            // removal claims the callback, so one racing with onCancel still runs once
            for (Runnable callback : callbacks) {
                if (callbacks.remove(callback)) {
                    callback.run();
                }
            }
        }
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    public boolean canBeCancelled() {
        return cancellable;
    }

    /**
     * Runs {@code callback} when the token is cancelled, or immediately if it already is.
     */
    public void onCancel(Runnable callback) {
        if (!cancellable) {
            return;
        }
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
    }

    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new DispatchCancelledException();
        }
    }
}
