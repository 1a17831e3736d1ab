package com.taskforge.core.concurrent;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag handed to background executors.
 * <p>
 * Cancelling never interrupts a thread; executors poll {@link #isCancelled()}
 * or call {@link #throwIfCancelled()} between external calls.
 */
public final class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * @return true if this call flipped the token, false if it was already cancelled
     */
    public boolean cancel(String why) {
        return reason.compareAndSet(null, why == null ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    public void throwIfCancelled() {
        String why = reason.get();
        if (why != null) {
            throw new CancellationException(why);
        }
    }
}
