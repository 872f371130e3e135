package com.codeagent.engine.output;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SafeOutputTest {

    private static final ConfirmationRequest REQUEST = new ConfirmationRequest(
            "c1", ConfirmationKind.TOOL_EXECUTION, "Run bash", "Approve?", Map.of("tool_name", "bash"));

    @Test
    void emit_sinkThrows_isSwallowed() {
        SafeOutput output = new SafeOutput(event -> { throw new IllegalStateException("sink down"); });

        assertThatCode(() -> output.emit(new AgentEvent.StatusUpdate("ok", Map.of()))).doesNotThrowAnyException();
        assertThatCode(output::flush).doesNotThrowAnyException();
    }

    @Test
    void emit_forwardsEventsInOrder() {
        List<AgentEvent> seen = new ArrayList<>();
        SafeOutput output = new SafeOutput(seen::add);

        output.emit(new AgentEvent.StatusUpdate("one", Map.of()));
        output.emit(new AgentEvent.StatusUpdate("two", Map.of()));

        assertThat(seen).extracting(e -> ((AgentEvent.StatusUpdate) e).status()).containsExactly("one", "two");
    }

    @Test
    void requestConfirmation_defaultSink_denies() {
        SafeOutput output = new SafeOutput(event -> { });

        assertThat(output.requestConfirmation(REQUEST).approved()).isFalse();
    }

    @Test
    void requestConfirmation_throwingSink_deniesWithNote() {
        SafeOutput output = new SafeOutput(new AgentOutput() {
            @Override
            public void emitEvent(AgentEvent event) {
            }

            @Override
            public ConfirmationDecision requestConfirmation(ConfirmationRequest request) {
                throw new IllegalStateException("no terminal");
            }
        });

        ConfirmationDecision decision = output.requestConfirmation(REQUEST);

        assertThat(decision.approved()).isFalse();
        assertThat(decision.note()).isEqualTo(SafeOutput.CONFIRMATION_FAILED);
    }

    @Test
    void loggingOutput_approvesOnlyWhenConfigured() {
        assertThat(new LoggingOutput("s", true).requestConfirmation(REQUEST).approved()).isTrue();
        assertThat(new LoggingOutput("s", false).requestConfirmation(REQUEST).approved()).isFalse();
    }
}
