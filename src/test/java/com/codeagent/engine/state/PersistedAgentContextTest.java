package com.codeagent.engine.state;

import com.codeagent.engine.exception.SnapshotException;
import com.codeagent.engine.model.AgentConfig;
import com.codeagent.engine.model.ContentBlock;
import com.codeagent.engine.model.ExecutionContext;
import com.codeagent.engine.model.Message;
import com.codeagent.engine.model.TokenUsage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PersistedAgentContextTest {

    @TempDir
    Path tempDir;

    @Test
    void toFile_thenFromFile_restoresHistoryAndContext() {
        PersistedAgentContext snapshot = PersistedAgentContext.builder()
                .agentType("coding_agent")
                .config(AgentConfig.builder().maxSteps(7).systemPrompt("be brief").build())
                .conversationHistory(List.of(
                        Message.system("sys"),
                        Message.user("list files"),
                        Message.assistant(List.of(ContentBlock.toolUse("t1", "bash", Map.of("command", "ls")))),
                        Message.toolResult("t1", false, "a.txt")))
                .executionContext(ExecutionContext.builder()
                        .agentId("coding_agent")
                        .originalGoal("list files")
                        .currentTask("list files")
                        .currentStep(2)
                        .executionTime(Duration.ofMillis(1234))
                        .tokenUsage(new TokenUsage(10, 5, 15))
                        .build())
                .build();
        Path file = tempDir.resolve("snapshots/ctx.json");

        snapshot.toFile(file);
        PersistedAgentContext restored = PersistedAgentContext.fromFile(file);

        assertThat(restored.getVersion()).isEqualTo(PersistedAgentContext.CURRENT_VERSION);
        assertThat(restored.getConfig().getMaxSteps()).isEqualTo(7);
        assertThat(restored.getConfig().getSystemPrompt()).isEqualTo("be brief");
        assertThat(restored.getConversationHistory()).isEqualTo(snapshot.getConversationHistory());
        assertThat(restored.getExecutionContext().getOriginalGoal()).isEqualTo("list files");
        assertThat(restored.getExecutionContext().getExecutionTime()).isEqualTo(Duration.ofMillis(1234));
        assertThat(restored.getExecutionContext().getTokenUsage().getTotalTokens()).isEqualTo(15);
    }

    @Test
    void toJson_usesSnakeCaseKeys() {
        String json = PersistedAgentContext.builder().agentType("coding_agent").build().toJson();

        assertThat(json).contains("\"conversation_history\"").contains("\"saved_at\"").contains("\"agent_type\"");
    }

    @Test
    void fromJson_historyOnlyDocument_isAccepted() {
        PersistedAgentContext ctx = PersistedAgentContext.fromJson("""
                {"version":1,"conversation_history":[{"role":"user","content":"hi"}]}
                """);

        assertThat(ctx.getConfig()).isNull();
        assertThat(ctx.getExecutionContext()).isNull();
        assertThat(ctx.getConversationHistory()).containsExactly(Message.user("hi"));
    }

    @Test
    void fromJson_missingHistory_defaultsToEmpty() {
        PersistedAgentContext ctx = PersistedAgentContext.fromJson("{\"version\":1,\"conversation_history\":null}");

        assertThat(ctx.getConversationHistory()).isEmpty();
    }

    @Test
    void fromJson_newerVersion_isRejected() {
        assertThatThrownBy(() -> PersistedAgentContext.fromJson("{\"version\":2}"))
                .isInstanceOf(SnapshotException.class)
                .hasMessageContaining("Unsupported snapshot version 2");
    }

    @Test
    void fromJson_malformed_throwsSnapshotException() {
        assertThatThrownBy(() -> PersistedAgentContext.fromJson("{broken"))
                .isInstanceOf(SnapshotException.class);
    }

    @Test
    void fromFile_missing_throwsSnapshotException() {
        assertThatThrownBy(() -> PersistedAgentContext.fromFile(tempDir.resolve("missing.json")))
                .isInstanceOf(SnapshotException.class);
    }
}
