package com.codeagent.engine.cancel;

import java.util.concurrent.CompletableFuture;

/**
 * Observing side of a {@link CancellationController}.
 *
 * Offers a synchronous poll and a future that completes on cancellation. The
 * future is a copy of the controller's signal made once per registration, so
 * polling it every step adds no dependents, and a caller completing it cannot
 * fire the shared signal or reach other registrations.
 */
public final class CancellationRegistration {

    private final CancellationController controller;
    private final CompletableFuture<Void> cancelled;

    CancellationRegistration(CancellationController controller) {
        this.controller = controller;
        this.cancelled = controller.signal().copy();
    }

    public boolean isCancelled() {
        return controller.isCancelled();
    }

    /** Completes normally once the controller is cancelled; already complete if it was. */
    public CompletableFuture<Void> cancelled() {
        return cancelled;
    }

    public CancellationController controller() {
        return controller;
    }
}
