package com.codeagent.engine.output;

import com.codeagent.engine.model.ToolCall;
import com.codeagent.engine.tool.ToolResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of one tool invocation handed to the output sink. Started and
 * completed events for the same call share {@code executionId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolExecutionInfo {

    private String executionId;
    private String toolName;
    private Map<String, Object> parameters;
    private ToolExecutionStatus status;

    /** Null while executing */
    private ToolResult result;

    private Instant startTime;

    /** Null while executing */
    private Long executionTimeMs;

    public static ToolExecutionInfo started(ToolCall call) {
        return ToolExecutionInfo.builder()
                .executionId(call.getId())
                .toolName(call.getName())
                .parameters(call.getParameters())
                .status(ToolExecutionStatus.EXECUTING)
                .startTime(Instant.now())
                .build();
    }

    public ToolExecutionInfo completed(ToolResult result) {
        return ToolExecutionInfo.builder()
                .executionId(executionId)
                .toolName(toolName)
                .parameters(parameters)
                .status(result.isSuccess() ? ToolExecutionStatus.SUCCESS : ToolExecutionStatus.ERROR)
                .result(result)
                .startTime(startTime)
                .executionTimeMs(startTime != null ? Instant.now().toEpochMilli() - startTime.toEpochMilli() : null)
                .build();
    }
}
