package com.codeagent.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Run metadata owned and mutated by the engine.
 *
 * {@code originalGoal} is written once per engine lifetime; {@code currentTask}
 * and {@code currentStep} are reset for every task invocation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionContext {

    private String agentId;
    private String originalGoal;
    private String currentTask;
    private String projectPath;
    private int maxSteps;
    private int currentStep;

    @Builder.Default
    private Duration executionTime = Duration.ZERO;

    @Builder.Default
    private TokenUsage tokenUsage = new TokenUsage();

    /** Detached copy handed to event sinks. */
    public ExecutionContext copy() {
        return ExecutionContext.builder()
                .agentId(agentId)
                .originalGoal(originalGoal)
                .currentTask(currentTask)
                .projectPath(projectPath)
                .maxSteps(maxSteps)
                .currentStep(currentStep)
                .executionTime(executionTime)
                .tokenUsage(tokenUsage != null ? tokenUsage.copy() : new TokenUsage())
                .build();
    }
}
