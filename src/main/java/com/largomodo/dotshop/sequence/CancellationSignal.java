package com.largomodo.dotshop.sequence;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between the caller and a running sequence. The
 * sequencer checks it before pulling each frame.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
