package com.codeagent.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-agent configuration. Produced by the host and captured in snapshots.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentConfig {

    public static final List<String> DEFAULT_TOOLS =
            List.of("bash", "str_replace_based_edit_tool", "sequentialthinking", "task_done");

    @Builder.Default
    private int maxSteps = 200;

    @Builder.Default
    private boolean enableExtendedView = true;

    /** Names of the tools this agent may use */
    @Builder.Default
    private List<String> tools = new ArrayList<>(DEFAULT_TOOLS);

    @Builder.Default
    private OutputMode outputMode = OutputMode.NORMAL;

    /** Replaces the default system prompt when set */
    private String systemPrompt;

    public AgentConfig copy() {
        return toBuilder().tools(new ArrayList<>(tools)).build();
    }
}
