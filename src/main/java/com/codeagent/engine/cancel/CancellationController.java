package com.codeagent.engine.cancel;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Triggering side of a one-way stop signal.
 *
 * A controller can be cancelled once; later calls are no-ops. Every registration
 * obtained from {@link #subscribe()}, before or after the cancel, observes it.
 * The engine may be handed a new controller per task; an old controller keeps
 * reaching whatever was registered against it.
 */
@Slf4j
public final class CancellationController {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    public static CancellationController create() {
        return new CancellationController();
    }

    /**
     * Fire the signal. Idempotent and irreversible.
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        log.debug("Cancellation requested");
        signal.complete(null);
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public CancellationRegistration subscribe() {
        return new CancellationRegistration(this);
    }

    CompletableFuture<Void> signal() {
        return signal;
    }
}
