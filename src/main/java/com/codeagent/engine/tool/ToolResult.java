package com.codeagent.engine.tool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolResult {

    /** Echo of the originating tool-use id */
    private String toolCallId;

    private boolean success;

    /** Observation text fed back to the model */
    private String content;

    /** Structured payload, e.g. {@code thought} for thought-stream tools */
    private Map<String, Object> data;

    public static ToolResult success(String toolCallId, String content) {
        return new ToolResult(toolCallId, true, content, null);
    }

    public static ToolResult success(String toolCallId, String content, Map<String, Object> data) {
        return new ToolResult(toolCallId, true, content, data);
    }

    public static ToolResult error(String toolCallId, String message) {
        return new ToolResult(toolCallId, false, message, null);
    }
}
