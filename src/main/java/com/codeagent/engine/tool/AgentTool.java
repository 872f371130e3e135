package com.codeagent.engine.tool;

import com.codeagent.engine.model.ToolCall;

import java.util.Map;
import java.util.Set;

/**
 * Contract every tool must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the model so it knows how to invoke the tool.
 *
 * Expected failures (bad arguments, missing files) should come back as an error
 * {@link ToolResult}. Anything thrown is converted into an error result by the engine.
 */
public interface AgentTool {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /**
     * Human-readable description. This is the primary signal the model uses
     * to decide when to call this tool.
     */
    String getDescription();

    /** JSON Schema (as a Map) describing the tool's input parameters. */
    Map<String, Object> getInputSchema();

    ToolResult execute(ToolCall call);

    /** Whether the host must approve each invocation before it runs. */
    default boolean requiresConfirmation() {
        return false;
    }

    /** Behavioural flags the engine reacts to. */
    default Set<ToolCapability> capabilities() {
        return Set.of();
    }
}
