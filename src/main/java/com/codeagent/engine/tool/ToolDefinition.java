package com.codeagent.engine.tool;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Immutable snapshot of a tool's schema sent to the model.
 * Decouples the provider serialization format from the AgentTool implementation.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    public static ToolDefinition from(AgentTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(tool.getInputSchema())
                .build();
    }

    /** { "type": "function", "function": { "name", "description", "parameters" } } */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", inputSchema
                )
        );
    }

    /** { "name", "description", "input_schema" } */
    public Map<String, Object> toAnthropicSchema() {
        return Map.of(
                "name", name,
                "description", description,
                "input_schema", inputSchema
        );
    }
}
