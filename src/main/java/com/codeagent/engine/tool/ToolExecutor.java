package com.codeagent.engine.tool;

import com.codeagent.engine.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The tool capability one engine works with: a fixed, ordered set of tools.
 *
 * An unknown tool name yields an error result. Exceptions thrown by a tool
 * propagate to the caller, which turns them into error results.
 */
@Slf4j
public class ToolExecutor {

    private final Map<String, AgentTool> tools;

    public ToolExecutor(Map<String, AgentTool> tools) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
    }

    public static ToolExecutor of(AgentTool... tools) {
        Map<String, AgentTool> map = new LinkedHashMap<>();
        for (AgentTool tool : tools) {
            map.put(tool.getName(), tool);
        }
        return new ToolExecutor(map);
    }

    public ToolResult execute(ToolCall call) {
        AgentTool tool = tools.get(call.getName());
        if (tool == null) {
            String msg = String.format("Unknown tool '%s'. Available tools: %s", call.getName(), tools.keySet());
            log.warn(msg);
            return ToolResult.error(call.getId(), msg);
        }

        log.info("Executing tool: [{}] with args: {}", call.getName(), call.getParameters());
        ToolResult result = tool.execute(call);
        if (result.getToolCallId() == null) {
            result.setToolCallId(call.getId());
        }
        log.debug("Tool [{}] returned success={}", call.getName(), result.isSuccess());
        return result;
    }

    public boolean requiresConfirmation(String name) {
        AgentTool tool = tools.get(name);
        return tool != null && tool.requiresConfirmation();
    }

    public boolean hasCapability(String name, ToolCapability capability) {
        AgentTool tool = tools.get(name);
        return tool != null && tool.capabilities().contains(capability);
    }

    public List<ToolDefinition> getToolDefinitions() {
        return tools.values().stream().map(ToolDefinition::from).toList();
    }

    public List<String> listTools() {
        return new ArrayList<>(tools.keySet());
    }

    public Optional<AgentTool> getTool(String name) {
        return Optional.ofNullable(tools.get(name));
    }
}
