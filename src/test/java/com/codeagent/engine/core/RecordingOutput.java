package com.codeagent.engine.core;

import com.codeagent.engine.output.AgentEvent;
import com.codeagent.engine.output.AgentOutput;
import com.codeagent.engine.output.ConfirmationDecision;
import com.codeagent.engine.output.ConfirmationRequest;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/** Test sink: keeps every event and answers confirmations with a fixed decision. */
class RecordingOutput implements AgentOutput {

    final List<AgentEvent> events = new CopyOnWriteArrayList<>();
    final List<ConfirmationRequest> confirmations = new CopyOnWriteArrayList<>();
    volatile ConfirmationDecision decision = ConfirmationDecision.deny("not in tests");
    volatile int flushes;

    @Override
    public void emitEvent(AgentEvent event) {
        events.add(event);
    }

    @Override
    public ConfirmationDecision requestConfirmation(ConfirmationRequest request) {
        confirmations.add(request);
        return decision;
    }

    @Override
    public void flush() {
        flushes++;
    }

    <T extends AgentEvent> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    long terminalEvents() {
        return events.stream()
                .filter(e -> e instanceof AgentEvent.ExecutionCompleted || e instanceof AgentEvent.ExecutionInterrupted)
                .count();
    }
}
