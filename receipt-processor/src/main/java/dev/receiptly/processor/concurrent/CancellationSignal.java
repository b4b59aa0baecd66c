package dev.receiptly.processor.concurrent;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and a running ingestion. Work checks the
 * signal at step boundaries and before each remote call.
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal(false);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final boolean cancellable;

    public CancellationSignal() {
        this(true);
    }

    private CancellationSignal(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Signal that can never be cancelled.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        if (cancellable) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String operation) {
        if (isCancelled()) {
            throw new CancellationException("Cancelled before " + operation);
        }
    }
}
