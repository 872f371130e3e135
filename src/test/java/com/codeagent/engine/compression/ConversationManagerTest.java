package com.codeagent.engine.compression;

import com.codeagent.engine.exception.CompressionException;
import com.codeagent.engine.model.ContentBlock;
import com.codeagent.engine.model.ExecutionContext;
import com.codeagent.engine.model.Message;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversationManagerTest {

    @Mock Summarizer summarizer;

    private final ExecutionContext context = ExecutionContext.builder().originalGoal("fix the build").build();

    @Test
    void maybeCompress_underTarget_returnsUnchanged() {
        ConversationManager manager = manager(10_000, 4_000);
        List<Message> messages = List.of(Message.system("sys"), Message.user("hi"));

        CompressionResult result = manager.maybeCompress(messages, context);

        assertThat(result.isCompressed()).isFalse();
        assertThat(result.messages()).isSameAs(messages);
        verify(summarizer, never()).summarize(anyList(), any());
    }

    @Test
    void maybeCompress_oversizedPayload_appliesLightTruncation() {
        ConversationManager manager = manager(10_000, 100);
        List<Message> messages = List.of(Message.system("sys"), Message.user("x".repeat(40_000)));

        CompressionResult result = manager.maybeCompress(messages, context);

        assertThat(result.isCompressed()).isTrue();
        assertThat(result.compressionApplied().getLevel()).isEqualTo(CompressionLevel.LIGHT);
        assertThat(result.messages()).hasSize(2);
        assertThat(result.messages().get(1).textContent().orElseThrow()).contains("characters truncated");
        assertThat(result.compressionApplied().getTokensSaved()).isPositive();
        verify(summarizer, never()).summarize(anyList(), any());
    }

    @Test
    void maybeCompress_longHistory_summarisesAndKeepsSystemFirst() {
        when(summarizer.summarize(anyList(), any())).thenReturn("earlier work summarised");
        ConversationManager manager = manager(1_000, 4_000);
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("You are a coding agent"));
        for (int i = 0; i < 40; i++) {
            messages.add(i % 2 == 0 ? Message.user("u".repeat(400)) : Message.assistant("a".repeat(400)));
        }

        CompressionResult result = manager.maybeCompress(messages, context);

        assertThat(result.isCompressed()).isTrue();
        assertThat(result.compressionApplied().getLevel()).isEqualTo(CompressionLevel.CRITICAL);
        List<Message> out = result.messages();
        assertThat(out.get(0).getRole()).isEqualTo(Message.Role.system);
        assertThat(out.get(1).textContent().orElseThrow())
                .startsWith(ConversationManager.SUMMARY_HEADER)
                .contains("earlier work summarised");
        assertThat(out.get(1).getMetadata()).containsEntry("compression_level", "critical");
        assertThat(out).hasSize(2 + CompressionLevel.CRITICAL.keepRecent());
        assertThat(result.compressionApplied().getMessagesBefore()).isEqualTo(41);
        assertThat(result.compressionApplied().getMessagesAfter()).isEqualTo(out.size());
    }

    @Test
    void maybeCompress_tailNeverStartsWithToolResult() {
        when(summarizer.summarize(anyList(), any())).thenReturn("summary");
        ConversationManager manager = manager(1_000, 4_000);
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("sys"));
        messages.add(Message.user("start"));
        for (int i = 0; i < 20; i++) {
            messages.add(Message.assistant(List.of(ContentBlock.toolUse("tu_" + i, "bash", Map.of("command", "x".repeat(300))))));
            messages.add(Message.toolResult("tu_" + i, false, "y".repeat(300)));
        }
        messages.add(Message.assistant("done"));

        CompressionResult result = manager.maybeCompress(messages, context);

        List<Message> out = result.messages();
        assertThat(out.get(2).getRole()).isNotEqualTo(Message.Role.tool);
        assertThat(out.get(out.size() - 1).textContent()).contains("done");
    }

    @Test
    void maybeCompress_summarizerFails_throwsCompressionException() {
        when(summarizer.summarize(anyList(), any())).thenThrow(new CompressionException("model down", null));
        ConversationManager manager = manager(1_000, 4_000);

        assertThatThrownBy(() -> manager.maybeCompress(longHistory(), context))
                .isInstanceOf(CompressionException.class)
                .hasMessageContaining("model down");
    }

    @Test
    void maybeCompress_unexpectedSummarizerError_isWrapped() {
        when(summarizer.summarize(anyList(), any())).thenThrow(new IllegalStateException("bug"));
        ConversationManager manager = manager(1_000, 4_000);

        assertThatThrownBy(() -> manager.maybeCompress(longHistory(), context))
                .isInstanceOf(CompressionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void stats_reportsUtilisationAgainstBudget() {
        ConversationManager manager = manager(1_000, 4_000);

        ConversationTokenStats stats = manager.stats(longHistory());

        assertThat(stats.tokenBudget()).isEqualTo(1_000);
        assertThat(stats.messageCount()).isEqualTo(31);
        assertThat(stats.utilization()).isGreaterThan(1.0);
        assertThat(stats.compressionRecommended()).isTrue();
        assertThat(manager.targetTokens()).isEqualTo(800);
    }

    @Test
    void constructor_rejectsInvalidThreshold() {
        assertThatThrownBy(() -> new ConversationManager(new TokenCalculator(), summarizer, 1_000, 1.5, 100))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void digestSummarizer_countsTurnsAndTools() {
        List<Message> dropped = List.of(
                Message.user("do it"),
                Message.assistant(List.of(ContentBlock.toolUse("1", "bash", Map.of()))),
                Message.toolResult("1", false, "ok"),
                Message.assistant(List.of(ContentBlock.toolUse("2", "bash", Map.of()))));

        String summary = new DigestSummarizer().summarize(dropped, context);

        assertThat(summary).contains("4 earlier messages").contains("1 user, 2 assistant").contains("bash x2");
    }

    private ConversationManager manager(long budget, int maxPayloadChars) {
        return new ConversationManager(new TokenCalculator(), summarizer, budget, 0.8, maxPayloadChars);
    }

    private static List<Message> longHistory() {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("sys"));
        for (int i = 0; i < 30; i++) {
            messages.add(i % 2 == 0 ? Message.user("u".repeat(400)) : Message.assistant("a".repeat(400)));
        }
        return messages;
    }
}
