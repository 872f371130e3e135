package com.codeagent.engine.trajectory;

import com.codeagent.engine.model.AgentConfig;
import com.codeagent.engine.model.LlmResponse;
import com.codeagent.engine.model.Message;
import com.codeagent.engine.model.ToolCall;
import com.codeagent.engine.tool.ToolResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One immutable journal record. Payloads are copied references; callers must
 * not mutate what they hand in after recording.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrajectoryEntry {

    private String id;
    private Instant timestamp;
    private int step;
    private EntryType entryType;

    public static TrajectoryEntry of(EntryType type, int step) {
        return new TrajectoryEntry(UUID.randomUUID().toString(), Instant.now(), step, type);
    }

    public static TrajectoryEntry taskStart(String task, AgentConfig config) {
        return of(new EntryType.TaskStart(task, config), 0);
    }

    public static TrajectoryEntry llmRequest(List<Message> messages, String model, String provider, int step) {
        return of(new EntryType.LlmRequest(List.copyOf(messages), model, provider), step);
    }

    public static TrajectoryEntry llmResponse(LlmResponse response, int step) {
        return of(new EntryType.LlmResponse(response.getMessage(), response.getUsage(),
                response.getFinishReason()), step);
    }

    public static TrajectoryEntry toolCall(ToolCall call, int step) {
        return of(new EntryType.ToolCall(call), step);
    }

    public static TrajectoryEntry toolResult(ToolResult result, int step) {
        return of(new EntryType.ToolResult(result), step);
    }

    public static TrajectoryEntry stepComplete(String summary, boolean success, int step) {
        return of(new EntryType.StepComplete(summary, success), step);
    }

    public static TrajectoryEntry error(String error, String context, int step) {
        return of(new EntryType.Error(error, context), step);
    }

    public static TrajectoryEntry taskComplete(boolean success, String finalResult, int totalSteps, long durationMs) {
        return of(new EntryType.TaskComplete(success, finalResult, totalSteps, durationMs), totalSteps);
    }
}
