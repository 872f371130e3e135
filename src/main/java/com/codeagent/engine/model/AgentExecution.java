package com.codeagent.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one task invocation. Every terminal path produces one, carrying
 * the step count and the elapsed wall-clock time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentExecution {

    public enum Status { COMPLETED, FAILED, INTERRUPTED }

    private Status status;
    private boolean success;
    private String finalResult;
    private int stepsExecuted;
    private long durationMs;

    public static AgentExecution success(String result, int steps, long durationMs) {
        return new AgentExecution(Status.COMPLETED, true, result, steps, durationMs);
    }

    public static AgentExecution failure(String result, int steps, long durationMs) {
        return new AgentExecution(Status.FAILED, false, result, steps, durationMs);
    }

    public static AgentExecution interrupted(int steps, long durationMs) {
        return new AgentExecution(Status.INTERRUPTED, false, "Execution interrupted", steps, durationMs);
    }
}
