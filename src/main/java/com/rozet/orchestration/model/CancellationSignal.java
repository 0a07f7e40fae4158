package com.rozet.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for lock waits and task loops. A signal is cancelled once
 * {@link #cancel()} has been called or its deadline has passed.
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal(null);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Instant deadline;

    private CancellationSignal(@Nullable Instant deadline) {
        this.deadline = deadline;
    }

    public static CancellationSignal none() {
        return NONE;
    }

    public static CancellationSignal create() {
        return new CancellationSignal(null);
    }

    public static CancellationSignal withDeadline(Instant deadline) {
        return new CancellationSignal(deadline);
    }

    public static CancellationSignal withTimeout(Duration timeout) {
        return new CancellationSignal(Instant.now().plus(timeout));
    }

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("The shared no-op signal cannot be cancelled.");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    @Nullable
    public Instant deadline() {
        return deadline;
    }
}
