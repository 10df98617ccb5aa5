package org.sensorvault.storage.api;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for long-running storage work.
 * <p>
 * Workers call {@link #throwIfCancelled()} between units of work (chunks, segments, partitions),
 * never inside one, so a cancelled operation never leaves a unit half-applied. Interrupting the
 * worker thread counts as cancellation as well.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Returns a token that is never cancelled (thread interruption is still honoured).
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    /**
     * @param what description of the interrupted work, used in the exception message
     * @throws CancellationException if cancellation was requested or the thread was interrupted
     */
    public void throwIfCancelled(String what) {
        if (isCancelled()) {
            throw new CancellationException(what + " cancelled");
        }
    }

    public void throwIfCancelled() {
        throwIfCancelled("Operation");
    }
}
