package com.codeagent.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** Metadata key under which the engine passes the task's project directory */
    public static final String PROJECT_PATH_KEY = "project_path";

    /** Tool-use id assigned by the model; echoed back on the result */
    private String id;

    private String name;

    private Map<String, Object> parameters;

    private Map<String, Object> metadata;

    public static ToolCall from(ContentBlock.ToolUse toolUse) {
        return ToolCall.builder()
                .id(toolUse.getId())
                .name(toolUse.getName())
                .parameters(toolUse.getInput() != null ? toolUse.getInput() : Map.of())
                .build();
    }
}
