package com.codeagent.engine.cancel;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationControllerTest {

    @Test
    void cancel_firstCall_returnsTrue_laterCallsNoop() {
        CancellationController controller = CancellationController.create();

        assertThat(controller.cancel()).isTrue();
        assertThat(controller.cancel()).isFalse();
        assertThat(controller.isCancelled()).isTrue();
    }

    @Test
    void registration_beforeCancel_observesSignal() throws Exception {
        CancellationController controller = CancellationController.create();
        CancellationRegistration registration = controller.subscribe();
        CompletableFuture<Void> cancelled = registration.cancelled();

        assertThat(registration.isCancelled()).isFalse();
        assertThat(cancelled).isNotDone();

        controller.cancel();

        cancelled.get(1, TimeUnit.SECONDS);
        assertThat(registration.isCancelled()).isTrue();
    }

    @Test
    void registration_afterCancel_isAlreadyCancelled() {
        CancellationController controller = CancellationController.create();
        controller.cancel();

        CancellationRegistration late = controller.subscribe();

        assertThat(late.isCancelled()).isTrue();
        assertThat(late.cancelled()).isCompleted();
    }

    @Test
    void cancelledFuture_completedByCaller_doesNotFireController() {
        CancellationController controller = CancellationController.create();
        CancellationRegistration registration = controller.subscribe();

        registration.cancelled().complete(null);

        assertThat(controller.isCancelled()).isFalse();
        assertThat(registration.isCancelled()).isFalse();
        assertThat(controller.subscribe().cancelled()).isNotDone();
    }

    @Test
    void cancelled_repeatedPolling_reusesOneFuture() {
        CancellationController controller = CancellationController.create();
        CancellationRegistration registration = controller.subscribe();

        CompletableFuture<Void> first = registration.cancelled();
        for (int i = 0; i < 100; i++) {
            assertThat(registration.cancelled()).isSameAs(first);
        }

        assertThat(controller.signal().getNumberOfDependents()).isEqualTo(1);
    }

    @Test
    void controllers_areIndependent() {
        CancellationController first = CancellationController.create();
        CancellationController second = CancellationController.create();
        CancellationRegistration onSecond = second.subscribe();

        first.cancel();

        assertThat(onSecond.isCancelled()).isFalse();
        assertThat(onSecond.controller()).isSameAs(second);
    }
}
