package com.codeagent.engine.tool.impl;

import com.codeagent.engine.model.ToolCall;
import com.codeagent.engine.tool.AgentTool;
import com.codeagent.engine.tool.ToolCapability;
import com.codeagent.engine.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scratchpad for step-by-step reasoning. Nothing is executed; the thought is
 * echoed back and surfaced to the host as a thinking event.
 */
@Component
@Slf4j
public class SequentialThinkingTool implements AgentTool {

    @Override
    public String getName() {
        return "sequentialthinking";
    }

    @Override
    public String getDescription() {
        return """
                Think through a problem one step at a time before acting.
                Use it to break a task into steps, revise an earlier thought, or
                check a hypothesis. Each call records one thought.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "thought", Map.of(
                                "type", "string",
                                "description", "The current thinking step"
                        ),
                        "thought_number", Map.of(
                                "type", "integer",
                                "description", "Index of this thought, starting at 1"
                        ),
                        "total_thoughts", Map.of(
                                "type", "integer",
                                "description", "Current estimate of thoughts needed"
                        ),
                        "next_thought_needed", Map.of(
                                "type", "boolean",
                                "description", "Whether another thought step follows"
                        )
                ),
                "required", List.of("thought")
        );
    }

    @Override
    public ToolResult execute(ToolCall call) {
        Map<String, Object> params = call.getParameters() != null ? call.getParameters() : Map.of();
        Object thought = params.get("thought");
        if (!(thought instanceof String text) || text.isBlank()) {
            return ToolResult.error(call.getId(), "'thought' is required");
        }

        int number = intParam(params, "thought_number", 1);
        int total = Math.max(number, intParam(params, "total_thoughts", number));
        boolean nextNeeded = Boolean.TRUE.equals(params.get("next_thought_needed"));

        log.debug("Thought {}/{}", number, total);

        Map<String, Object> data = new HashMap<>();
        data.put("thought", text);
        data.put("thought_number", number);
        data.put("total_thoughts", total);
        data.put("next_thought_needed", nextNeeded);

        String content = "Thought: " + text + "\n\n"
                + String.format("Thought %d of %d recorded.%s", number, total,
                        nextNeeded ? " Continue thinking." : "");
        return ToolResult.success(call.getId(), content, data);
    }

    @Override
    public Set<ToolCapability> capabilities() {
        return Set.of(ToolCapability.THOUGHT_STREAM);
    }

    private static int intParam(Map<String, Object> params, String key, int fallback) {
        Object value = params.get(key);
        return value instanceof Number n ? n.intValue() : fallback;
    }
}
