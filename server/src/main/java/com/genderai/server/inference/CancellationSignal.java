package com.genderai.server.inference;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Work checks it only at safe points, such as
 * before starting a forward pass; a pass already running is left to finish.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws CancelledException if {@link #cancel()} has been called
     */
    public void checkpoint(String stage) {
        if (cancelled.get()) {
            throw new CancelledException("Cancelled before " + stage);
        }
    }
}
