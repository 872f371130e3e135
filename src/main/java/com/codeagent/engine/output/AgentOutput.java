package com.codeagent.engine.output;

import java.util.Map;

/**
 * Event sink the engine reports to. Implementations may throw; the engine wraps
 * every sink in {@link SafeOutput} so a failing sink never affects a run.
 */
public interface AgentOutput {

    void emitEvent(AgentEvent event) throws Exception;

    /**
     * Ask the host to approve a tool execution. Throwing counts as a denial.
     * Sinks without an interactive user deny by default.
     */
    default ConfirmationDecision requestConfirmation(ConfirmationRequest request) throws Exception {
        return ConfirmationDecision.deny("No confirmation handler available");
    }

    default void flush() throws Exception {
    }

    default void normal(String content) throws Exception {
        emitEvent(new AgentEvent.Message(MessageLevel.NORMAL, content, Map.of()));
    }

    default void info(String content) throws Exception {
        emitEvent(new AgentEvent.Message(MessageLevel.INFO, content, Map.of()));
    }

    default void debug(String content) throws Exception {
        emitEvent(new AgentEvent.Message(MessageLevel.DEBUG, content, Map.of()));
    }

    default void warning(String content) throws Exception {
        emitEvent(new AgentEvent.Message(MessageLevel.WARNING, content, Map.of()));
    }

    default void error(String content) throws Exception {
        emitEvent(new AgentEvent.Message(MessageLevel.ERROR, content, Map.of()));
    }
}
