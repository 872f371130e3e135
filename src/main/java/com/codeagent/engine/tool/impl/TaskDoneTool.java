package com.codeagent.engine.tool.impl;

import com.codeagent.engine.model.ToolCall;
import com.codeagent.engine.tool.AgentTool;
import com.codeagent.engine.tool.ToolCapability;
import com.codeagent.engine.tool.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Called by the model once the task is finished. A successful call ends the run.
 */
@Component
public class TaskDoneTool implements AgentTool {

    @Override
    public String getName() {
        return "task_done";
    }

    @Override
    public String getDescription() {
        return """
                Report that the task is complete. Call this only after the work has been
                verified, for example by running the relevant tests or reproducing the fix.
                Optionally include a short summary of what was done.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "summary", Map.of(
                                "type", "string",
                                "description", "Short summary of the completed work"
                        )
                ),
                "required", List.of()
        );
    }

    @Override
    public ToolResult execute(ToolCall call) {
        Object summary = call.getParameters() != null ? call.getParameters().get("summary") : null;
        String content = summary instanceof String s && !s.isBlank() ? s : "Task completed";
        return ToolResult.success(call.getId(), content);
    }

    @Override
    public Set<ToolCapability> capabilities() {
        return Set.of(ToolCapability.COMPLETION_SIGNAL);
    }
}
