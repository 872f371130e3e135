package com.codeagent.engine.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class StepScopeTest {

    private final Object historyLock = new Object();

    @Test
    void abandon_dropsLaterMutationsAndEmissions() {
        StepScope scope = new StepScope(historyLock, 1);
        List<String> effects = new ArrayList<>();

        assertThat(scope.mutate(() -> effects.add("before"))).isTrue();
        scope.abandon();

        assertThat(scope.mutate(() -> effects.add("history"))).isFalse();
        assertThat(scope.publish(() -> effects.add("event"))).isFalse();
        assertThat(scope.isAbandoned()).isTrue();
        assertThat(effects).containsExactly("before");
    }

    @Test
    void slowEmission_doesNotBlockAbandonOrHistoryReads() throws Exception {
        StepScope scope = new StepScope(historyLock, 1);
        CountDownLatch emitting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Boolean> slow = CompletableFuture.supplyAsync(() -> scope.publish(() -> {
            emitting.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        assertThat(emitting.await(5, TimeUnit.SECONDS)).isTrue();

        assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
            assertThat(scope.read(() -> "history")).isEqualTo("history");
            scope.abandon();
        });
        assertThat(scope.mutate(() -> { })).isFalse();

        release.countDown();
        assertThat(slow.get(5, TimeUnit.SECONDS)).isTrue();
    }
}
