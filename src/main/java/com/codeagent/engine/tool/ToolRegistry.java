package com.codeagent.engine.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for all AgentTool implementations.
 *
 * Spring auto-discovers every @Component that implements AgentTool
 * and injects them as a List<AgentTool>. Each agent gets a {@link ToolExecutor}
 * restricted to the tool names in its configuration.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<AgentTool> toolBeans) {
        toolBeans.forEach(this::register);
        log.info("Total tools registered: {}", tools.size());
    }

    public void register(AgentTool tool) {
        AgentTool previous = tools.put(tool.getName(), tool);
        if (previous != null) {
            log.warn("Tool [{}] replaced an existing registration", tool.getName());
        }
        log.info("Registered tool: [{}]", tool.getName());
    }

    /**
     * Executor over the named tools, in the given order. Unknown names are
     * logged and skipped.
     */
    public ToolExecutor createExecutor(List<String> names) {
        Map<String, AgentTool> selected = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String name : names) {
            AgentTool tool = tools.get(name);
            if (tool == null) {
                missing.add(name);
            } else {
                selected.put(name, tool);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Requested tools not registered, skipping: {}", missing);
        }
        return new ToolExecutor(selected);
    }

    public Set<String> registeredNames() {
        return Set.copyOf(tools.keySet());
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }
}
