package com.codeagent.engine.tool;

import com.codeagent.engine.model.ToolCall;
import com.codeagent.engine.tool.impl.SequentialThinkingTool;
import com.codeagent.engine.tool.impl.TaskDoneTool;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolExecutorTest {

    private final ToolExecutor executor = ToolExecutor.of(new TaskDoneTool(), new SequentialThinkingTool());

    @Test
    void execute_unknownTool_returnsErrorResultListingTools() {
        ToolResult result = executor.execute(call("t1", "rm_rf", Map.of()));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getToolCallId()).isEqualTo("t1");
        assertThat(result.getContent())
                .contains("Unknown tool 'rm_rf'")
                .contains("task_done")
                .contains("sequentialthinking");
    }

    @Test
    void execute_taskDone_usesSummaryAsContent() {
        ToolResult result = executor.execute(call("t2", "task_done", Map.of("summary", "Fixed the bug")));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getContent()).isEqualTo("Fixed the bug");
    }

    @Test
    void capabilities_identifyCompletionAndThoughtTools() {
        assertThat(executor.hasCapability("task_done", ToolCapability.COMPLETION_SIGNAL)).isTrue();
        assertThat(executor.hasCapability("sequentialthinking", ToolCapability.THOUGHT_STREAM)).isTrue();
        assertThat(executor.hasCapability("sequentialthinking", ToolCapability.COMPLETION_SIGNAL)).isFalse();
        assertThat(executor.hasCapability("missing", ToolCapability.COMPLETION_SIGNAL)).isFalse();
    }

    @Test
    void execute_toolThrows_propagates() {
        AgentTool failing = mock(AgentTool.class);
        when(failing.getName()).thenReturn("flaky");
        when(failing.execute(any())).thenThrow(new IllegalStateException("disk on fire"));

        ToolExecutor withFailing = ToolExecutor.of(failing);

        assertThatThrownBy(() -> withFailing.execute(call("t3", "flaky", Map.of())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("disk on fire");
    }

    @Test
    void execute_resultWithoutId_getsCallId() {
        AgentTool tool = mock(AgentTool.class);
        when(tool.getName()).thenReturn("anon");
        when(tool.execute(any())).thenReturn(ToolResult.builder().success(true).content("ok").build());

        ToolResult result = ToolExecutor.of(tool).execute(call("t4", "anon", Map.of()));

        assertThat(result.getToolCallId()).isEqualTo("t4");
    }

    @Test
    void listTools_keepsRegistrationOrder() {
        assertThat(executor.listTools()).containsExactly("task_done", "sequentialthinking");
        assertThat(executor.getToolDefinitions()).extracting(ToolDefinition::getName)
                .containsExactly("task_done", "sequentialthinking");
    }

    @Test
    void registry_createExecutor_skipsUnknownNames() {
        ToolRegistry registry = new ToolRegistry(List.of(new TaskDoneTool()));

        ToolExecutor selected = registry.createExecutor(List.of("bash", "task_done"));

        assertThat(selected.listTools()).containsExactly("task_done");
        assertThat(registry.hasTool("bash")).isFalse();
    }

    private static ToolCall call(String id, String name, Map<String, Object> params) {
        return ToolCall.builder().id(id).name(name).parameters(params).build();
    }
}
