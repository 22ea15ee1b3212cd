package com.workflow.bsp.api;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag shared by every task of one superstep.
 *
 * Compute units should call {@link #throwIfCancelled()} at their yield points.
 * The scheduler additionally registers callbacks that interrupt running tasks,
 * so blocking calls that honour interruption stop promptly.
 */
public final class CancellationSignal {
    private volatile boolean cancelled;
    private volatile String reason;
    private final List<Runnable> callbacks = new ArrayList<>();

    /** Handle for removing a callback registered with {@link #onCancel}. */
    public interface Registration {
        void remove();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** @return why the signal was cancelled, or null while it is not. */
    public String reason() {
        return reason;
    }

    /**
     * Cancels the signal and runs the registered callbacks. Only the first call
     * has an effect.
     */
    public void cancel(String why) {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled)
                return;
            reason = why;
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable r : toRun)
            r.run();
    }

    /**
     * Registers a callback. If the signal is already cancelled the callback
     * runs immediately on the calling thread.
     */
    public Registration onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (CancellationSignal.this) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> {
        };
    }

    public void throwIfCancelled() {
        if (cancelled)
            throw new CancellationException(reason);
    }
}
