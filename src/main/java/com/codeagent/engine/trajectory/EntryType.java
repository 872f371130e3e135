package com.codeagent.engine.trajectory;

import com.codeagent.engine.model.AgentConfig;
import com.codeagent.engine.model.FinishReason;
import com.codeagent.engine.model.Message;
import com.codeagent.engine.model.Usage;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Payload of a trajectory entry, tagged by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EntryType.TaskStart.class, name = "task_start"),
        @JsonSubTypes.Type(value = EntryType.LlmRequest.class, name = "llm_request"),
        @JsonSubTypes.Type(value = EntryType.LlmResponse.class, name = "llm_response"),
        @JsonSubTypes.Type(value = EntryType.ToolCall.class, name = "tool_call"),
        @JsonSubTypes.Type(value = EntryType.ToolResult.class, name = "tool_result"),
        @JsonSubTypes.Type(value = EntryType.StepComplete.class, name = "step_complete"),
        @JsonSubTypes.Type(value = EntryType.Error.class, name = "error"),
        @JsonSubTypes.Type(value = EntryType.TaskComplete.class, name = "task_complete")
})
public abstract class EntryType {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class TaskStart extends EntryType {
        private String task;
        private AgentConfig agentConfig;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class LlmRequest extends EntryType {
        private List<Message> messages;
        private String model;
        private String provider;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class LlmResponse extends EntryType {
        private Message message;
        private Usage usage;
        private FinishReason finishReason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class ToolCall extends EntryType {
        private com.codeagent.engine.model.ToolCall toolCall;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class ToolResult extends EntryType {
        private com.codeagent.engine.tool.ToolResult result;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class StepComplete extends EntryType {
        private String stepSummary;
        private boolean success;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class Error extends EntryType {
        private String error;
        private String context;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class TaskComplete extends EntryType {
        private boolean success;
        private String finalResult;
        private int totalSteps;
        private long durationMs;
    }
}
