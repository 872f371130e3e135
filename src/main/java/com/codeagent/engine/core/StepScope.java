package com.codeagent.engine.core;

import java.util.function.Supplier;

/**
 * Guards the side effects of one step.
 *
 * Every history mutation, event and journal entry a step produces goes through
 * its scope. Once the engine abandons the step (cancellation won the race),
 * further effects are dropped.
 *
 * History mutations run under the engine's history lock, as does
 * {@link #abandon()}, so a mutation is either fully applied before abandonment
 * or not at all. Events and journal writes run outside that lock and are only
 * gated on the flag: a slow sink or disk never delays abandonment or the
 * history accessors. An emission already in flight when the step is abandoned
 * may still complete.
 */
final class StepScope {

    private final Object historyLock;
    private final int step;
    private volatile boolean abandoned;

    StepScope(Object historyLock, int step) {
        this.historyLock = historyLock;
        this.step = step;
    }

    int step() {
        return step;
    }

    /** Apply a history or context mutation unless the step was abandoned. */
    boolean mutate(Runnable mutation) {
        synchronized (historyLock) {
            if (abandoned) return false;
            mutation.run();
            return true;
        }
    }

    /** Emit an event or journal entry unless the step was abandoned. */
    boolean publish(Runnable effect) {
        if (abandoned) return false;
        effect.run();
        return true;
    }

    <T> T read(Supplier<T> reader) {
        synchronized (historyLock) {
            return reader.get();
        }
    }

    void abandon() {
        synchronized (historyLock) {
            abandoned = true;
        }
    }

    boolean isAbandoned() {
        return abandoned;
    }
}
